package com.passage.proxy.core.http;

import com.passage.proxy.core.target.ResolvedTarget;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.InputStream;

/**
 * An inbound request after target resolution, ready to be forwarded.
 */
public class ProxyRequest {
    /** Body length value meaning "unknown, read until the stream ends". */
    public static final long UNKNOWN_LENGTH = -1;

    private final String method;
    private final ResolvedTarget target;
    private final HttpHeaderMap headers;
    private final InputStream body;
    private final long bodyLength;

    /**
     * @param method     HTTP method as received.
     * @param target     Normalized absolute target.
     * @param headers    Inbound headers.
     * @param body       Request body, or {@code null} when there is none.
     * @param bodyLength Declared body length, {@link #UNKNOWN_LENGTH} for chunked
     *                   bodies, 0 when there is no body.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public ProxyRequest(String method, ResolvedTarget target, HttpHeaderMap headers, InputStream body,
            long bodyLength) {
        this.method = method;
        this.target = target;
        this.headers = headers;
        this.body = body;
        this.bodyLength = body == null ? 0 : bodyLength;
    }

    public String getMethod() {
        return method;
    }

    public ResolvedTarget getTarget() {
        return target;
    }

    public String getTargetUrl() {
        return target.href();
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public HttpHeaderMap getHeaders() {
        return headers;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public InputStream getBody() {
        return body;
    }

    public long getBodyLength() {
        return bodyLength;
    }

    public boolean hasBody() {
        return body != null && bodyLength != 0;
    }
}
