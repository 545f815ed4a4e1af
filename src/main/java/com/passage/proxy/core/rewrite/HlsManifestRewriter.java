package com.passage.proxy.core.rewrite;

import com.passage.proxy.core.constants.HeaderConstants;
import com.passage.proxy.core.exceptions.RewriteException;
import com.passage.proxy.core.http.HttpHeaderMap;
import com.passage.proxy.core.target.UrlResolver;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites HLS playlists so that every segment and variant URI is fetched
 * through the proxy.
 * <p>
 * Applies to responses whose content type contains {@code mpegurl}. Comment
 * and directive lines (starting with {@code #}) and empty lines are kept
 * byte for byte; every other line becomes {@code <prefix><absolute URL>}.
 * Lines are joined with {@code \n}. A gzip or deflate body is inflated first
 * and sent on uncompressed.
 */
public class HlsManifestRewriter implements ResponseRewriter {
    private static final Logger log = LoggerFactory.getLogger(HlsManifestRewriter.class);

    private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");

    private final String proxyPrefix;

    public HlsManifestRewriter(String proxyPrefix) {
        this.proxyPrefix = proxyPrefix;
    }

    @Override
    public RewriteContext apply(RewriteContext context) {
        HttpHeaderMap headers = context.getHeaders();
        String contentType = headers.first(HeaderConstants.CONTENT_TYPE.getValue());
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).contains("mpegurl")
                || !context.hasBody() || context.getBody() == null) {
            return context;
        }

        String encoding = headers.first(HeaderConstants.CONTENT_ENCODING.getValue());
        String coding = encoding == null ? "identity" : encoding.trim().toLowerCase(Locale.ROOT);
        if (!"identity".equals(coding) && !"gzip".equals(coding) && !"x-gzip".equals(coding)
                && !"deflate".equals(coding)) {
            log.debug("Skipping manifest rewrite for {}: unsupported content encoding {}",
                    context.getRequestUrl(), encoding);
            return context;
        }

        byte[] raw;
        try (InputStream in = context.getBody()) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            try {
                in.transferTo(buffer);
            } catch (IOException e) {
                log.warn("Manifest from {} truncated after {} bytes: {}", context.getRequestUrl(), buffer.size(),
                        e.getMessage());
                return passThrough(context, headers, buffer.toByteArray());
            }
            raw = buffer.toByteArray();
        } catch (IOException e) {
            log.debug("Error closing manifest body: {}", e.getMessage());
            return context.withBody(new ByteArrayInputStream(new byte[0]));
        }

        byte[] plain;
        try {
            plain = decode(raw, coding);
        } catch (IOException e) {
            log.warn("Cannot decode {} manifest from {}: {}", coding, context.getRequestUrl(), e.getMessage());
            return passThrough(context, headers, raw);
        }

        String rewritten = rewrite(new String(plain, StandardCharsets.UTF_8), context.getRequestUrl());
        byte[] out = rewritten.getBytes(StandardCharsets.UTF_8);

        headers.remove(HeaderConstants.CONTENT_ENCODING.getValue());
        if (headers.contains(HeaderConstants.CONTENT_LENGTH.getValue())) {
            headers.replaceValue(HeaderConstants.CONTENT_LENGTH.getValue(), String.valueOf(out.length));
        }
        return context.with(headers, new ByteArrayInputStream(out));
    }

    /**
     * Rewrites the URI lines of a playlist.
     *
     * @param manifest   Playlist text.
     * @param requestUrl URL the playlist was fetched from.
     * @return The rewritten playlist, lines joined with {@code \n}.
     */
    String rewrite(String manifest, String requestUrl) {
        String[] lines = LINE_BREAK.split(manifest, -1);
        StringBuilder sb = new StringBuilder(manifest.length() + lines.length * proxyPrefix.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(rewriteLine(lines[i], requestUrl));
        }
        return sb.toString();
    }

    private String rewriteLine(String line, String requestUrl) {
        if (line.isEmpty() || line.startsWith("#")) {
            return line;
        }
        if (LocationHeaderRewriter.ABSOLUTE_HTTP.matcher(line).lookingAt()) {
            return proxyPrefix + line;
        }
        if (requestUrl == null) {
            return line;
        }
        try {
            return proxyPrefix + UrlResolver.resolve(requestUrl, line);
        } catch (RewriteException e) {
            log.warn("Leaving manifest line '{}' unchanged: {}", line, e.getMessage());
            return line;
        }
    }

    private static byte[] decode(byte[] raw, String coding) throws IOException {
        InputStream decoder;
        switch (coding) {
            case "gzip", "x-gzip" -> decoder = new GZIPInputStream(new ByteArrayInputStream(raw));
            case "deflate" -> decoder = new InflaterInputStream(new ByteArrayInputStream(raw));
            default -> {
                return raw;
            }
        }
        try (decoder) {
            return decoder.readAllBytes();
        }
    }

    private static RewriteContext passThrough(RewriteContext context, HttpHeaderMap headers, byte[] bytes) {
        if (headers.contains(HeaderConstants.CONTENT_LENGTH.getValue())) {
            headers.replaceValue(HeaderConstants.CONTENT_LENGTH.getValue(), String.valueOf(bytes.length));
        }
        return context.with(headers, new ByteArrayInputStream(bytes));
    }
}
