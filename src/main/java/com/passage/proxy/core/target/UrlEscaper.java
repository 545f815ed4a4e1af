package com.passage.proxy.core.target;

import java.nio.charset.StandardCharsets;

/**
 * Percent-encodes the characters browsers and origins leave raw in URLs but
 * {@link java.net.URI} rejects: space, {@code " < > ` { } | \ ^}, controls,
 * a second {@code #}, square brackets outside the authority, and non-ASCII
 * (as UTF-8). Existing {@code %XX} escapes are kept; a stray {@code %} becomes
 * {@code %25}.
 */
final class UrlEscaper {

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private UrlEscaper() {
    }

    static String escape(String url) {
        int authorityEnd = authorityEnd(url);
        StringBuilder sb = null;
        boolean seenFragment = false;
        for (int i = 0; i < url.length(); i++) {
            char c = url.charAt(i);
            boolean keep;
            if (c == '%') {
                keep = i + 2 < url.length() && isHex(url.charAt(i + 1)) && isHex(url.charAt(i + 2));
            } else if (c == '#') {
                keep = !seenFragment;
                seenFragment = true;
            } else if (c == '[' || c == ']') {
                keep = i < authorityEnd;
            } else {
                keep = isAllowed(c);
            }
            if (keep) {
                if (sb != null) {
                    sb.append(c);
                }
                continue;
            }
            if (sb == null) {
                sb = new StringBuilder(url.length() + 16).append(url, 0, i);
            }
            int end = i + 1;
            if (Character.isHighSurrogate(c) && end < url.length() && Character.isLowSurrogate(url.charAt(end))) {
                end++;
            }
            for (byte b : url.substring(i, end).getBytes(StandardCharsets.UTF_8)) {
                sb.append('%').append(HEX[(b >> 4) & 0x0F]).append(HEX[b & 0x0F]);
            }
            i = end - 1;
        }
        return sb == null ? url : sb.toString();
    }

    /** Index just past the authority of {@code scheme://host} or {@code //host}, 0 when there is none. */
    private static int authorityEnd(String url) {
        int start;
        int colon = url.indexOf("://");
        if (url.startsWith("//")) {
            start = 2;
        } else if (colon > 0 && isScheme(url.substring(0, colon))) {
            start = colon + 3;
        } else {
            return 0;
        }
        int end = start;
        while (end < url.length() && "/?#".indexOf(url.charAt(end)) < 0) {
            end++;
        }
        return end;
    }

    private static boolean isScheme(String s) {
        if (s.isEmpty() || !isAsciiLetter(s.charAt(0))) {
            return false;
        }
        for (int i = 1; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!isAsciiLetter(c) && !isDigit(c) && c != '+' && c != '-' && c != '.') {
                return false;
            }
        }
        return true;
    }

    // RFC 3986 unreserved and reserved characters, minus the ones handled above
    private static boolean isAllowed(char c) {
        return isAsciiLetter(c) || isDigit(c) || "-._~:/?@!$&'()*+,;=".indexOf(c) >= 0;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHex(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
