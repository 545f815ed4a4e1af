package com.passage.proxy.core.rewrite;

import com.passage.proxy.core.http.HttpHeaderMap;
import com.passage.proxy.core.http.ProxyResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.InputStream;

/**
 * Immutable view of a response as it moves through the rewrite stages.
 * Headers are copied on the way in and on the way out, so a stage can only
 * change what the next stage sees by returning a new snapshot.
 */
public final class RewriteContext {

    private final int status;
    private final String requestMethod;
    private final HttpHeaderMap headers;
    private final InputStream body;
    private final String requestUrl;

    public RewriteContext(int status, String requestMethod, HttpHeaderMap headers, InputStream body,
            String requestUrl) {
        this.status = status;
        this.requestMethod = requestMethod;
        this.headers = headers.copy();
        this.body = body;
        this.requestUrl = requestUrl;
    }

    /**
     * @param response      Response as returned by the forwarder.
     * @param requestMethod Method of the request that produced it.
     * @return the initial snapshot
     */
    public static RewriteContext of(ProxyResponse response, String requestMethod) {
        return new RewriteContext(response.getStatus(), requestMethod, response.getHeaders(), response.getBody(),
                response.getRequestUrl());
    }

    public ProxyResponse toResponse() {
        return new ProxyResponse(status, headers, body, requestUrl);
    }

    public int getStatus() {
        return status;
    }

    public String getRequestMethod() {
        return requestMethod;
    }

    /**
     * @return a copy of the headers
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

    /**
     * @return {@code false} for HEAD requests and for 1xx, 204 and 304 responses
     */
    public boolean hasBody() {
        return !"HEAD".equalsIgnoreCase(requestMethod) && status >= 200 && status != 204 && status != 304;
    }

    public RewriteContext withHeaders(HttpHeaderMap newHeaders) {
        return new RewriteContext(status, requestMethod, newHeaders, body, requestUrl);
    }

    public RewriteContext withBody(InputStream newBody) {
        return new RewriteContext(status, requestMethod, headers, newBody, requestUrl);
    }

    public RewriteContext with(HttpHeaderMap newHeaders, InputStream newBody) {
        return new RewriteContext(status, requestMethod, newHeaders, newBody, requestUrl);
    }
}
