package com.passage.proxy.core.rewrite;

import com.passage.proxy.core.http.HttpHeaderMap;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPOutputStream;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HlsManifestRewriterTest {

    private static final String URL = "https://example.com/video/playlist.m3u8";

    private final HlsManifestRewriter rewriter = new HlsManifestRewriter("/proxy/");

    private static InputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private static String read(RewriteContext context) throws IOException {
        try (InputStream in = context.getBody()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void manifest_segmentsAreProxied() throws Exception {
        String manifest = "#EXTM3U\r\nsegment1.ts\r\n//cdn.example.com/seg2.ts\r\n";
        HttpHeaderMap headers = new HttpHeaderMap()
                .add("Content-Type", "application/vnd.apple.mpegurl")
                .add("content-length", String.valueOf(manifest.length()));

        RewriteContext result = rewriter.apply(new RewriteContext(200, "GET", headers, stream(manifest), URL));

        String expected = "#EXTM3U\n"
                + "/proxy/https://example.com/video/segment1.ts\n"
                + "/proxy/https://cdn.example.com/seg2.ts\n";
        assertThat(read(result)).isEqualTo(expected);
        assertThat(result.getHeaders().first("Content-Length"))
                .isEqualTo(String.valueOf(expected.getBytes(StandardCharsets.UTF_8).length));
        assertThat(result.getHeaders().storedName("content-length")).isEqualTo("content-length");
    }

    @Test
    void streamManifest_relativeAndAbsoluteSegments() throws Exception {
        HttpHeaderMap headers = new HttpHeaderMap().add("content-type", "application/vnd.apple.mpegurl");
        String manifest = "#EXTM3U\nsegment1.ts\nhttps://cdn.example.com/seg2.ts\n";

        RewriteContext result = rewriter.apply(new RewriteContext(200, "GET", headers, stream(manifest),
                "https://example.com/video/stream.m3u8"));

        assertThat(read(result)).isEqualTo("#EXTM3U\n"
                + "/proxy/https://example.com/video/segment1.ts\n"
                + "/proxy/https://cdn.example.com/seg2.ts\n");
    }

    @Test
    void manifest_withoutContentLength_doesNotGainOne() throws Exception {
        HttpHeaderMap headers = new HttpHeaderMap().add("Content-Type", "audio/mpegurl");

        RewriteContext result = rewriter.apply(
                new RewriteContext(200, "GET", headers, stream("#EXTM3U\nhttp://a.b/c.ts"), URL));

        assertThat(read(result)).isEqualTo("#EXTM3U\n/proxy/http://a.b/c.ts");
        assertThat(result.getHeaders().contains("Content-Length")).isFalse();
    }

    @Test
    void gzipManifest_isInflatedAndRewritten() throws Exception {
        ByteArrayOutputStream compressed = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(compressed)) {
            gzip.write("#EXTM3U\n#EXT-X-STREAM-INF:BANDWIDTH=1\nlow/index.m3u8\n".getBytes(StandardCharsets.UTF_8));
        }
        HttpHeaderMap headers = new HttpHeaderMap()
                .add("Content-Type", "application/x-mpegURL")
                .add("Content-Encoding", "gzip");

        RewriteContext result = rewriter.apply(new RewriteContext(200, "GET", headers,
                new ByteArrayInputStream(compressed.toByteArray()), URL));

        assertThat(read(result))
                .isEqualTo("#EXTM3U\n#EXT-X-STREAM-INF:BANDWIDTH=1\n/proxy/https://example.com/video/low/index.m3u8\n");
        assertThat(result.getHeaders().contains("Content-Encoding")).isFalse();
    }

    @Test
    void unsupportedEncoding_isPassedThrough() {
        HttpHeaderMap headers = new HttpHeaderMap()
                .add("Content-Type", "application/vnd.apple.mpegurl")
                .add("Content-Encoding", "br");
        RewriteContext context = new RewriteContext(200, "GET", headers, stream("opaque"), URL);

        assertThat(rewriter.apply(context)).isSameAs(context);
    }

    @Test
    void headRequest_isNotTouched() {
        HttpHeaderMap headers = new HttpHeaderMap()
                .add("Content-Type", "application/vnd.apple.mpegurl")
                .add("Content-Length", "500");
        RewriteContext context = new RewriteContext(200, "HEAD", headers, stream(""), URL);

        RewriteContext result = rewriter.apply(context);

        assertThat(result).isSameAs(context);
        assertThat(result.getHeaders().first("Content-Length")).isEqualTo("500");
    }

    @Test
    void otherContentTypes_areNotTouched() {
        HttpHeaderMap headers = new HttpHeaderMap().add("Content-Type", "video/mp2t");
        RewriteContext context = new RewriteContext(200, "GET", headers, stream("segment.ts"), URL);

        assertThat(rewriter.apply(context)).isSameAs(context);
    }

    @Test
    void truncatedBody_isForwardedAsReceived() throws Exception {
        InputStream failing = new InputStream() {
            private final InputStream data = stream("#EXTM3U\nseg");

            @Override
            public int read() throws IOException {
                int b = data.read();
                if (b == -1) {
                    throw new IOException("connection reset");
                }
                return b;
            }
        };
        HttpHeaderMap headers = new HttpHeaderMap()
                .add("Content-Type", "application/vnd.apple.mpegurl")
                .add("Content-Length", "100");

        RewriteContext result = rewriter.apply(new RewriteContext(200, "GET", headers, failing, URL));

        assertThat(read(result)).isEqualTo("#EXTM3U\nseg");
        assertThat(result.getHeaders().first("Content-Length")).isEqualTo("11");
    }

    @Test
    void rewrite_keepsBlankAndDirectiveLines() {
        String out = rewriter.rewrite("#EXTM3U\n\n#EXT-X-KEY:METHOD=AES-128,URI=\"key.bin\"\n/abs/seg.ts", URL);

        assertThat(out).isEqualTo("#EXTM3U\n\n#EXT-X-KEY:METHOD=AES-128,URI=\"key.bin\"\n"
                + "/proxy/https://example.com/abs/seg.ts");
    }

    @Test
    void segmentWithSpace_isEscapedAndProxied() throws Exception {
        HttpHeaderMap headers = new HttpHeaderMap().add("Content-Type", "application/x-mpegURL");

        RewriteContext result = rewriter.apply(
                new RewriteContext(200, "GET", headers, stream("#EXTM3U\nseg 1.ts\n"), URL));

        assertThat(read(result)).isEqualTo("#EXTM3U\n/proxy/https://example.com/video/seg%201.ts\n");
    }
}
