package com.passage.proxy.core.target;

import com.passage.proxy.core.exceptions.RewriteException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.regex.Pattern;

/**
 * Resolves references found in upstream responses against the URL that
 * produced them.
 * <p>
 * {@link URI#resolve(URI)} follows RFC 2396, which differs from RFC 3986 for
 * empty and query-only references and keeps {@code ..} segments that climb
 * above the root. Those cases are handled here. Characters {@link URI}
 * rejects but browsers tolerate are percent-encoded first.
 */
public final class UrlResolver {

    private static final Pattern ABSOLUTE_HTTP = Pattern.compile("^https?://", Pattern.CASE_INSENSITIVE);

    private UrlResolver() {
    }

    /**
     * @param base      Absolute URL of the document containing the reference.
     * @param reference Absolute, protocol-relative, root-relative or relative reference.
     * @return The absolute URL.
     * @throws RewriteException if either argument cannot be parsed.
     */
    public static String resolve(String base, String reference) {
        if (ABSOLUTE_HTTP.matcher(reference).lookingAt()) {
            return reference;
        }
        try {
            URI baseUri = new URI(UrlEscaper.escape(base));
            URI ref = new URI(UrlEscaper.escape(reference));
            if (ref.isAbsolute()) {
                return ref.toString();
            }
            if (reference.isEmpty()) {
                return withoutFragment(baseUri, baseUri.getRawQuery());
            }
            if (reference.startsWith("?")) {
                return withoutFragment(baseUri, ref.getRawQuery())
                        + (ref.getRawFragment() != null ? "#" + ref.getRawFragment() : "");
            }
            if (baseUri.getRawPath() == null || baseUri.getRawPath().isEmpty()) {
                baseUri = new URI(baseUri.getScheme() + "://" + baseUri.getRawAuthority() + "/");
            }
            return dropLeadingDotSegments(baseUri.resolve(ref));
        } catch (URISyntaxException e) {
            throw new RewriteException("Cannot resolve '" + reference + "' against '" + base + "'", e);
        }
    }

    private static String withoutFragment(URI uri, String query) {
        StringBuilder sb = new StringBuilder();
        sb.append(uri.getScheme()).append("://").append(uri.getRawAuthority());
        String path = uri.getRawPath();
        sb.append(path == null || path.isEmpty() ? "/" : path);
        if (query != null) {
            sb.append('?').append(query);
        }
        return sb.toString();
    }

    private static String dropLeadingDotSegments(URI resolved) {
        String path = resolved.getRawPath();
        if (path == null || !path.startsWith("/..")) {
            return resolved.toString();
        }
        while (path.startsWith("/../")) {
            path = path.substring(3);
        }
        if ("/..".equals(path)) {
            path = "/";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(resolved.getScheme()).append("://").append(resolved.getRawAuthority()).append(path);
        if (resolved.getRawQuery() != null) {
            sb.append('?').append(resolved.getRawQuery());
        }
        if (resolved.getRawFragment() != null) {
            sb.append('#').append(resolved.getRawFragment());
        }
        return sb.toString();
    }
}
