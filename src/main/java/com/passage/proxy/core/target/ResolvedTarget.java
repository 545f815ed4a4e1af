package com.passage.proxy.core.target;

import java.net.URI;

/**
 * A normalized absolute target URL.
 *
 * @param href         Canonical string form, used as the rewrite base.
 * @param uri          Parsed form of {@code href}.
 * @param strippedPort Explicit non-default port removed during normalization,
 *                     or {@code -1} if none was removed.
 */
public record ResolvedTarget(String href, URI uri, int strippedPort) {

    /**
     * @return {@code true} if an explicit non-default port was removed.
     */
    public boolean portStripped() {
        return strippedPort != -1;
    }

    public String scheme() {
        return uri.getScheme();
    }

    public boolean isSecure() {
        return TargetResolver.HTTPS.equals(uri.getScheme());
    }

    public String host() {
        return uri.getHost();
    }

    /**
     * @return the port to connect to, the scheme default when none is explicit.
     */
    public int port() {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return TargetResolver.defaultPort(uri.getScheme());
    }

    /**
     * Value for the {@code Host} header: host plus port when it is explicit.
     *
     * @return authority without user info
     */
    public String hostHeader() {
        return uri.getPort() == -1 ? uri.getHost() : uri.getHost() + ":" + uri.getPort();
    }

    /**
     * Origin-form request target: raw path plus raw query.
     *
     * @return e.g. {@code /chat?room=1}
     */
    public String requestTarget() {
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        return uri.getRawQuery() == null ? path : path + "?" + uri.getRawQuery();
    }
}
