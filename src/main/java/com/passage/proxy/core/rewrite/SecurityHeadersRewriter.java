package com.passage.proxy.core.rewrite;

import com.passage.proxy.core.constants.HeaderConstants;
import com.passage.proxy.core.http.HttpHeaderMap;
import java.util.List;

/**
 * Removes origin policies that would stop proxied pages from rendering or
 * that pin the origin's own host.
 */
public class SecurityHeadersRewriter implements ResponseRewriter {

    static final List<String> STRIPPED = List.of(
            HeaderConstants.X_FRAME_OPTIONS.getValue(),
            HeaderConstants.CONTENT_SECURITY_POLICY.getValue(),
            HeaderConstants.STRICT_TRANSPORT_SECURITY.getValue(),
            HeaderConstants.PUBLIC_KEY_PINS.getValue());

    @Override
    public RewriteContext apply(RewriteContext context) {
        HttpHeaderMap headers = context.getHeaders();
        boolean changed = false;
        for (String name : STRIPPED) {
            changed |= headers.remove(name);
        }
        return changed ? context.withHeaders(headers) : context;
    }
}
