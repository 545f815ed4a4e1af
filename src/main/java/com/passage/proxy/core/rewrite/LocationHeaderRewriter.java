package com.passage.proxy.core.rewrite;

import com.passage.proxy.core.constants.HeaderConstants;
import com.passage.proxy.core.exceptions.RewriteException;
import com.passage.proxy.core.http.HttpHeaderMap;
import com.passage.proxy.core.target.UrlResolver;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Points redirects back through the proxy.
 * <p>
 * A {@code Location} value that already contains the prefix is left alone.
 * Absolute http(s) values are prefixed as they are; anything else is first
 * resolved against the URL that produced the response. The result is stored
 * under the canonical name {@code Location}.
 */
public class LocationHeaderRewriter implements ResponseRewriter {
    private static final Logger log = LoggerFactory.getLogger(LocationHeaderRewriter.class);

    static final Pattern ABSOLUTE_HTTP = Pattern.compile("^https?://", Pattern.CASE_INSENSITIVE);

    private final String proxyPrefix;

    public LocationHeaderRewriter(String proxyPrefix) {
        this.proxyPrefix = proxyPrefix;
    }

    @Override
    public RewriteContext apply(RewriteContext context) {
        HttpHeaderMap headers = context.getHeaders();
        String location = headers.first(HeaderConstants.LOCATION.getValue());
        if (location == null || location.contains(proxyPrefix)) {
            return context;
        }

        String absolute;
        if (ABSOLUTE_HTTP.matcher(location).lookingAt() || context.getRequestUrl() == null) {
            absolute = location;
        } else {
            try {
                absolute = UrlResolver.resolve(context.getRequestUrl(), location);
            } catch (RewriteException e) {
                log.warn("Leaving Location '{}' unchanged: {}", location, e.getMessage());
                return context;
            }
        }

        headers.set(HeaderConstants.LOCATION.getValue(), proxyPrefix + absolute);
        return context.withHeaders(headers);
    }
}
