package com.passage.proxy.core.rewrite;

import com.passage.proxy.core.constants.HeaderConstants;
import com.passage.proxy.core.http.HttpHeaderMap;

/**
 * Makes every proxied response readable cross-origin and advertises range
 * support. Upstream values for these headers are replaced.
 */
public class CorsHeadersRewriter implements ResponseRewriter {

    static final String ALLOW_ORIGIN = "*";
    static final String ALLOW_METHODS = "GET, POST, PUT, DELETE, OPTIONS";
    static final String ALLOW_HEADERS = "*";
    static final String EXPOSE_HEADERS = "Content-Length, Content-Range, Accept-Ranges, Content-Type, Location";
    static final String ACCEPT_RANGES = "bytes";

    @Override
    public RewriteContext apply(RewriteContext context) {
        HttpHeaderMap headers = context.getHeaders();
        headers.set(HeaderConstants.ACCESS_CONTROL_ALLOW_ORIGIN.getValue(), ALLOW_ORIGIN);
        headers.set(HeaderConstants.ACCESS_CONTROL_ALLOW_METHODS.getValue(), ALLOW_METHODS);
        headers.set(HeaderConstants.ACCESS_CONTROL_ALLOW_HEADERS.getValue(), ALLOW_HEADERS);
        headers.set(HeaderConstants.ACCESS_CONTROL_EXPOSE_HEADERS.getValue(), EXPOSE_HEADERS);
        headers.set(HeaderConstants.ACCEPT_RANGES.getValue(), ACCEPT_RANGES);
        return context.withHeaders(headers);
    }
}
