package com.passage.proxy.core.constants;

/**
 * Common HTTP header names used by the proxy.
 */
public enum HeaderConstants {
    /** The Standard HTTP Host header. */
    HOST("Host"),
    /** Header used for credentials from client to proxy. */
    PROXY_AUTHORIZATION("Proxy-Authorization"),
    /** Header used for authentication challenges from proxy to client. */
    PROXY_AUTHENTICATE("Proxy-Authenticate"),
    /** Hop-by-hop Connection header. */
    CONNECTION("Connection"),
    /** Length of the entity body in bytes. */
    CONTENT_LENGTH("Content-Length"),
    /** Media type of the entity body. */
    CONTENT_TYPE("Content-Type"),
    /** Compression applied to the entity body. */
    CONTENT_ENCODING("Content-Encoding"),
    /** Type of encoding used to transfer the entity. */
    TRANSFER_ENCODING("Transfer-Encoding"),
    /** Specifies the persistent connection parameters. */
    KEEP_ALIVE("Keep-Alive"),
    /** Specifies the transfer encodings the client is willing to accept. */
    TE("TE"),
    /** Specifies that a set of header fields is present in the trailer. */
    TRAILER("Trailer"),
    /** Used by the client to request a protocol change. */
    UPGRADE("Upgrade"),
    /** Asks the server to confirm before the body is sent. */
    EXPECT("Expect"),
    /** Redirect target. */
    LOCATION("Location"),
    /** CORS: origins allowed to read the response. */
    ACCESS_CONTROL_ALLOW_ORIGIN("access-control-allow-origin"),
    /** CORS: methods allowed for cross-origin requests. */
    ACCESS_CONTROL_ALLOW_METHODS("access-control-allow-methods"),
    /** CORS: request headers allowed for cross-origin requests. */
    ACCESS_CONTROL_ALLOW_HEADERS("access-control-allow-headers"),
    /** CORS: response headers readable by cross-origin scripts. */
    ACCESS_CONTROL_EXPOSE_HEADERS("access-control-expose-headers"),
    /** Advertises byte-range support. */
    ACCEPT_RANGES("accept-ranges"),
    /** Anti-framing policy. */
    X_FRAME_OPTIONS("x-frame-options"),
    /** Content Security Policy. */
    CONTENT_SECURITY_POLICY("content-security-policy"),
    /** HSTS policy. */
    STRICT_TRANSPORT_SECURITY("strict-transport-security"),
    /** HPKP policy. */
    PUBLIC_KEY_PINS("public-key-pins");

    private final String value;

    HeaderConstants(String value) {
        this.value = value;
    }

    /**
     * Retrieves the standard string value of the header.
     *
     * @return The standard string value of the header.
     */
    public String getValue() {
        return value;
    }
}
