package com.passage.proxy.core.proxy;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.passage.proxy.config.PassageProperties;
import com.passage.proxy.core.pool.UpstreamPools;
import com.passage.proxy.core.services.AccessLogService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebProxyServerTest {

    private WireMockServer wireMockServer;
    private WebProxyServer proxyServer;
    private UpstreamPools pools;
    private MeterRegistry registry;
    private HttpClient client;
    private int proxyPort;
    private String origin;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(wireMockConfig().dynamicPort());
        wireMockServer.start();
        WireMock.configureFor("localhost", wireMockServer.port());
        origin = "http://localhost:" + wireMockServer.port();

        PassageProperties props = new PassageProperties();
        props.getServer().setPort(0);
        props.getServer().setShutdownGracePeriod(1000);
        props.getUpstream().setStripExplicitPorts(false);
        props.getUpstream().setTimeout(3000);
        props.validate();

        registry = new SimpleMeterRegistry();
        pools = new UpstreamPools(props.getUpstream(), registry);
        proxyServer = new WebProxyServer(props, pools, new AccessLogService(props.getLogging()), registry);
        Thread t = new Thread(proxyServer::start);
        t.setDaemon(true);
        t.start();
        assertThat(proxyServer.awaitBind(10, TimeUnit.SECONDS)).isTrue();
        proxyPort = proxyServer.getPort();

        client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        if (proxyServer != null)
            proxyServer.stop();
        if (pools != null)
            pools.close();
        if (wireMockServer != null)
            wireMockServer.stop();
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + proxyPort + path))
                .timeout(Duration.ofSeconds(10))
                .method(method, publisher)
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> fetch(String path) throws Exception {
        return send("GET", path, null);
    }

    private String raw(String request) throws IOException {
        try (Socket socket = new Socket("localhost", proxyPort)) {
            socket.setSoTimeout(5000);
            OutputStream out = socket.getOutputStream();
            out.write(request.getBytes(StandardCharsets.ISO_8859_1));
            out.flush();
            InputStream in = socket.getInputStream();
            return new String(in.readAllBytes(), StandardCharsets.ISO_8859_1);
        }
    }

    @Test
    void proxy_forwardsAndAddsCorsHeaders() throws Exception {
        stubFor(get(urlEqualTo("/page?x=1")).willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "text/html")
                .withHeader("X-Frame-Options", "DENY")
                .withHeader("Content-Security-Policy", "default-src 'self'")
                .withBody("<h1>hello</h1>")));

        HttpResponse<String> response = fetch("/proxy/" + origin + "/page?x=1");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("<h1>hello</h1>");
        assertThat(response.headers().firstValue("Access-Control-Allow-Origin")).hasValue("*");
        assertThat(response.headers().firstValue("Accept-Ranges")).hasValue("bytes");
        assertThat(response.headers().firstValue("Content-Type")).hasValue("text/html");
        assertThat(response.headers().firstValue("X-Frame-Options")).isEmpty();
        assertThat(response.headers().firstValue("Content-Security-Policy")).isEmpty();
        assertThat(registry.get("proxy.http.requests.total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void proxy_rewritesRedirectLocation() throws Exception {
        stubFor(get(urlEqualTo("/account")).willReturn(aResponse().withStatus(302).withHeader("Location", "/login")));

        HttpResponse<String> response = fetch("/proxy/" + origin + "/account");

        assertThat(response.statusCode()).isEqualTo(302);
        assertThat(response.headers().allValues("Location")).containsExactly("/proxy/" + origin + "/login");
    }

    @Test
    void proxy_rewritesHlsManifest() throws Exception {
        stubFor(get(urlEqualTo("/video/playlist.m3u8")).willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "application/vnd.apple.mpegurl")
                .withBody("#EXTM3U\nsegment1.ts\n//cdn.example.com/seg2.ts\n")));

        HttpResponse<String> response = fetch("/proxy/" + origin + "/video/playlist.m3u8");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("#EXTM3U\n"
                + "/proxy/" + origin + "/video/segment1.ts\n"
                + "/proxy/http://cdn.example.com/seg2.ts\n");
    }

    @Test
    void proxy_forwardsPostBody() throws Exception {
        stubFor(post(urlEqualTo("/api/items")).willReturn(aResponse().withStatus(201).withBody("created")));

        HttpResponse<String> response = send("POST", "/proxy/" + origin + "/api/items", "{\"name\":\"x\"}");

        assertThat(response.statusCode()).isEqualTo(201);
        assertThat(response.body()).isEqualTo("created");
        verify(postRequestedFor(urlEqualTo("/api/items")).withRequestBody(equalTo("{\"name\":\"x\"}")));
    }

    @Test
    void proxy_streamsLargeFixedLengthBody() throws Exception {
        stubFor(post(urlEqualTo("/upload/large")).willReturn(aResponse().withStatus(200).withBody("stored")));
        byte[] payload = new byte[1024 * 1024];
        new Random(42).nextBytes(payload);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + proxyPort + "/proxy/" + origin + "/upload/large"))
                .timeout(Duration.ofSeconds(20))
                .header("Content-Type", "application/octet-stream")
                .POST(HttpRequest.BodyPublishers.ofByteArray(payload))
                .build();
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("stored");
        verify(postRequestedFor(urlEqualTo("/upload/large"))
                .withHeader("Content-Length", equalTo(String.valueOf(payload.length)))
                .withRequestBody(binaryEqualTo(payload)));
    }

    @Test
    void proxy_headHasNoBody() throws Exception {
        stubFor(head(urlEqualTo("/file")).willReturn(aResponse().withStatus(200).withHeader("Content-Type", "video/mp4")));

        HttpResponse<String> response = send("HEAD", "/proxy/" + origin + "/file", null);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEmpty();
        assertThat(response.headers().firstValue("Access-Control-Allow-Origin")).hasValue("*");
    }

    @Test
    void proxy_acceptsCollapsedSchemeSlash() throws Exception {
        stubFor(get(urlEqualTo("/ok")).willReturn(aResponse().withStatus(200).withBody("ok")));

        HttpResponse<String> response = fetch("/proxy/http:/localhost:" + wireMockServer.port() + "/ok");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("ok");
    }

    @Test
    void proxy_keepsConnectionAliveBetweenRequests() throws Exception {
        stubFor(get(urlEqualTo("/a")).willReturn(aResponse().withStatus(200).withBody("A")));
        stubFor(get(urlEqualTo("/b")).willReturn(aResponse().withStatus(200).withBody("B")));

        String response = raw("GET /proxy/" + origin + "/a HTTP/1.1\r\nHost: localhost\r\n\r\n"
                + "GET /proxy/" + origin + "/b HTTP/1.1\r\nHost: localhost\r\nConnection: close\r\n\r\n");

        assertThat(response).startsWith("HTTP/1.1 200 OK");
        assertThat(response).contains("Connection: keep-alive");
        assertThat(response.split("HTTP/1.1 200 OK", -1)).hasSize(3);
        verify(getRequestedFor(urlEqualTo("/a")));
        verify(getRequestedFor(urlEqualTo("/b")));
    }

    @Test
    void invalidTarget_returns400() throws Exception {
        HttpResponse<String> response = fetch("/proxy/not-a-url");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                v -> assertThat(v).startsWith("text/plain"));
    }

    @Test
    void unsupportedScheme_returns400() throws Exception {
        HttpResponse<String> response = fetch("/proxy/ftp://example.com/file");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(response.body()).contains("ftp");
    }

    @Test
    void unreachableOrigin_returns502() throws Exception {
        int closedPort;
        try (ServerSocket s = new ServerSocket(0)) {
            closedPort = s.getLocalPort();
        }

        HttpResponse<String> response = fetch("/proxy/http://localhost:" + closedPort + "/");

        assertThat(response.statusCode()).isEqualTo(502);
    }

    @Test
    void unknownPath_returns404() throws Exception {
        HttpResponse<String> response = fetch("/elsewhere");

        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(response.body()).isEqualTo("Not Found: /elsewhere\n");
    }

    @Test
    void landingPage_isServedWithPrefix() throws Exception {
        HttpResponse<String> response = fetch("/");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).hasValue("text/html; charset=utf-8");
        assertThat(response.body()).contains("'/proxy/' + url").doesNotContain("{{PROXY_PREFIX}}");
    }

    @Test
    void landingPage_rejectsPost() throws Exception {
        HttpResponse<String> response = send("POST", "/", "x");

        assertThat(response.statusCode()).isEqualTo(405);
    }

    @Test
    void connect_isRejected() throws Exception {
        String response = raw("CONNECT example.com:443 HTTP/1.1\r\nHost: example.com:443\r\n\r\n");

        assertThat(response).startsWith("HTTP/1.1 405 Method Not Allowed");
    }

    @Test
    void malformedRequestLine_returns400() throws Exception {
        String response = raw("NONSENSE\r\n\r\n");

        assertThat(response).startsWith("HTTP/1.1 400 Bad Request");
        assertThat(response).contains("Connection: close");
    }

    @Test
    void unsupportedTransferEncoding_returns400() throws Exception {
        String response = raw("POST /proxy/" + origin + "/x HTTP/1.1\r\nHost: localhost\r\n"
                + "Transfer-Encoding: gzip\r\n\r\n");

        assertThat(response).startsWith("HTTP/1.1 400 Bad Request");
    }

    @Test
    void chunkedRequestBody_isForwarded() throws Exception {
        stubFor(post(urlEqualTo("/upload")).willReturn(aResponse().withStatus(200).withBody("done")));

        String response = raw("POST /proxy/" + origin + "/upload HTTP/1.1\r\nHost: localhost\r\n"
                + "Transfer-Encoding: chunked\r\nConnection: close\r\n\r\n"
                + "5\r\nhello\r\n6\r\n world\r\n0\r\n\r\n");

        assertThat(response).startsWith("HTTP/1.1 200 OK").contains("done");
        verify(postRequestedFor(urlEqualTo("/upload")).withRequestBody(equalTo("hello world")));
    }

    @Test
    void stop_closesListener() {
        proxyServer.stop();

        assertThat(proxyServer.isRunning()).isFalse();
        assertThatThrownBy(() -> new Socket("localhost", proxyPort).close())
                .isInstanceOf(IOException.class);
    }
}
