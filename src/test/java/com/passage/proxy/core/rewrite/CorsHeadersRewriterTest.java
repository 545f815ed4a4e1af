package com.passage.proxy.core.rewrite;

import com.passage.proxy.core.http.HttpHeaderMap;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CorsHeadersRewriterTest {

    @Test
    void apply_setsCorsHeadersReplacingUpstreamValues() {
        HttpHeaderMap upstream = new HttpHeaderMap()
                .add("access-control-allow-origin", "https://only.me")
                .add("Content-Type", "text/html");
        RewriteContext context = new RewriteContext(200, "GET", upstream, null, "https://example.com/");

        HttpHeaderMap result = new CorsHeadersRewriter().apply(context).getHeaders();

        assertThat(result.all("Access-Control-Allow-Origin")).containsExactly("*");
        assertThat(result.names()).containsOnlyOnce("access-control-allow-origin");
        assertThat(result.first("Access-Control-Allow-Methods")).isEqualTo("GET, POST, PUT, DELETE, OPTIONS");
        assertThat(result.first("Access-Control-Allow-Headers")).isEqualTo("*");
        assertThat(result.first("Access-Control-Expose-Headers"))
                .isEqualTo("Content-Length, Content-Range, Accept-Ranges, Content-Type, Location");
        assertThat(result.first("Accept-Ranges")).isEqualTo("bytes");
        assertThat(result.first("Content-Type")).isEqualTo("text/html");
    }

    @Test
    void apply_doesNotMutateInputSnapshot() {
        RewriteContext context = new RewriteContext(200, "GET", new HttpHeaderMap(), null, null);

        new CorsHeadersRewriter().apply(context);

        assertThat(context.getHeaders().isEmpty()).isTrue();
    }
}
