package com.passage.proxy.core.target;

import com.passage.proxy.core.exceptions.InvalidTargetUrlException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the part of an inbound path that follows the proxy prefix into a
 * normalized absolute target URL.
 * <p>
 * Only {@code http} and {@code https} targets with a host are accepted.
 * Explicit ports are removed so that origins are always reached on the
 * scheme's default port; removing a non-default port logs a warning and
 * increments {@code proxy.target.port.stripped}. Scheme and host are
 * lower-cased, an empty path becomes {@code /}, and the fragment is dropped.
 * A scheme whose double slash was merged ({@code https:/host}) is repaired,
 * and characters browsers send unencoded ({@code |}, space, non-ASCII) are
 * percent-encoded.
 * Path and query are kept in their raw (still percent-encoded) form.
 */
public class TargetResolver {

    private static final Logger log = LoggerFactory.getLogger(TargetResolver.class);

    static final String HTTP = "http";
    static final String HTTPS = "https";

    // "https:/host" left behind when a client or intermediary merges "//" in the path
    private static final Pattern COLLAPSED_SCHEME = Pattern.compile("^(?i)(https?):/(?!/)");

    private final boolean stripExplicitPorts;
    private final Counter portStripped;

    /**
     * @param stripExplicitPorts Whether non-default explicit ports are removed.
     * @param registry           Registry for the port-strip counter.
     */
    public TargetResolver(boolean stripExplicitPorts, MeterRegistry registry) {
        this.stripExplicitPorts = stripExplicitPorts;
        this.portStripped = Counter.builder("proxy.target.port.stripped")
                .description("Target URLs whose explicit port was removed")
                .register(registry);
    }

    /**
     * Parses and normalizes a target URL.
     *
     * @param raw Path remainder after the proxy prefix, query included.
     * @return The normalized target.
     * @throws InvalidTargetUrlException if {@code raw} is not an absolute http(s)
     *                                   URL with a host.
     */
    public ResolvedTarget resolve(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidTargetUrlException("Missing target URL");
        }

        URI uri;
        try {
            uri = new URI(UrlEscaper.escape(COLLAPSED_SCHEME.matcher(raw).replaceFirst("$1://")));
        } catch (URISyntaxException e) {
            throw new InvalidTargetUrlException("Invalid target URL: " + e.getMessage(), e);
        }

        if (!uri.isAbsolute() || uri.isOpaque()) {
            throw new InvalidTargetUrlException("Target URL must be absolute: " + raw);
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!HTTP.equals(scheme) && !HTTPS.equals(scheme)) {
            throw new InvalidTargetUrlException("Unsupported target scheme: " + scheme);
        }
        if (uri.getHost() == null || uri.getHost().isEmpty()) {
            throw new InvalidTargetUrlException("Target URL has no host: " + raw);
        }

        int port = uri.getPort();
        int stripped = -1;
        if (port == defaultPort(scheme)) {
            port = -1;
        } else if (port != -1 && stripExplicitPorts) {
            log.warn("[PORT-STRIP] Port {} removed, using standard port for {}:", port, scheme);
            portStripped.increment();
            stripped = port;
            port = -1;
        }

        String href = buildHref(scheme, uri, port);
        return new ResolvedTarget(href, URI.create(href), stripped);
    }

    private static String buildHref(String scheme, URI uri, int port) {
        StringBuilder sb = new StringBuilder(scheme).append("://");
        if (uri.getRawUserInfo() != null) {
            sb.append(uri.getRawUserInfo()).append('@');
        }
        sb.append(uri.getHost().toLowerCase(Locale.ROOT));
        if (port != -1) {
            sb.append(':').append(port);
        }
        String path = uri.getRawPath();
        sb.append(path == null || path.isEmpty() ? "/" : path);
        if (uri.getRawQuery() != null) {
            sb.append('?').append(uri.getRawQuery());
        }
        return sb.toString();
    }

    /**
     * @param scheme {@code http} or {@code https}, lower case.
     * @return 443 for https, 80 otherwise.
     */
    public static int defaultPort(String scheme) {
        return HTTPS.equals(scheme) ? 443 : 80;
    }
}
