package com.passage.proxy.core.http;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.InputStream;

/**
 * An upstream response on its way back to the client.
 * <p>
 * Immutable: {@link #withHeaders} and {@link #withBody} return new instances.
 * The body stream is shared, not copied, and must be closed by whoever
 * consumes the last instance.
 */
public final class ProxyResponse {

    private final int status;
    private final HttpHeaderMap headers;
    private final InputStream body;
    private final String requestUrl;

    /**
     * @param status     HTTP status code.
     * @param headers    Response headers; copied.
     * @param body       Response body, never {@code null}.
     * @param requestUrl Target URL of the request that produced this response.
     */
    public ProxyResponse(int status, HttpHeaderMap headers, InputStream body, String requestUrl) {
        this.status = status;
        this.headers = headers.copy();
        this.body = body;
        this.requestUrl = requestUrl;
    }

    public int getStatus() {
        return status;
    }

    /**
     * @return a copy of the headers; mutate it and pass it to {@link #withHeaders}
     */
    public HttpHeaderMap getHeaders() {
        return headers.copy();
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public InputStream getBody() {
        return body;
    }

    public String getRequestUrl() {
        return requestUrl;
    }

    public ProxyResponse withHeaders(HttpHeaderMap newHeaders) {
        return new ProxyResponse(status, newHeaders, body, requestUrl);
    }

    public ProxyResponse withBody(InputStream newBody) {
        return new ProxyResponse(status, headers, newBody, requestUrl);
    }
}
