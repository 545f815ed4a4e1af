package com.passage.proxy.core.forward;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.passage.proxy.config.UpstreamConfig;
import com.passage.proxy.core.exceptions.ProtocolException;
import com.passage.proxy.core.exceptions.UpstreamUnavailableException;
import com.passage.proxy.core.http.HttpHeaderMap;
import com.passage.proxy.core.http.ProxyRequest;
import com.passage.proxy.core.http.ProxyResponse;
import com.passage.proxy.core.pool.UpstreamPools;
import com.passage.proxy.core.target.TargetResolver;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.ServerSocket;
import java.net.http.HttpHeaders;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestForwarderTest {

    private WireMockServer wireMockServer;
    private MeterRegistry registry;
    private UpstreamPools pools;
    private TargetResolver resolver;
    private RequestForwarder forwarder;
    private String base;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(wireMockConfig().dynamicPort());
        wireMockServer.start();
        WireMock.configureFor("localhost", wireMockServer.port());
        base = "http://localhost:" + wireMockServer.port();

        registry = new SimpleMeterRegistry();
        UpstreamConfig config = new UpstreamConfig();
        config.setMaxConnectionsPerPool(1);
        config.setTimeout(2000);
        pools = new UpstreamPools(config, registry);
        resolver = new TargetResolver(false, registry);
        forwarder = new RequestForwarder(pools, 2000, registry);
    }

    @AfterEach
    void tearDown() {
        if (pools != null)
            pools.close();
        if (wireMockServer != null)
            wireMockServer.stop();
    }

    private ProxyRequest getRequest(String url, HttpHeaderMap headers) {
        return new ProxyRequest("GET", resolver.resolve(url), headers, null, 0);
    }

    private static String body(ProxyResponse response) throws IOException {
        try (InputStream in = response.getBody()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void forward_copiesHeadersAndStreamsBody() throws Exception {
        stubFor(get(urlEqualTo("/page?q=1"))
                .willReturn(aResponse().withStatus(200).withHeader("Content-Type", "text/html").withBody("hello")));
        HttpHeaderMap headers = new HttpHeaderMap()
                .add("Accept", "text/html")
                .add("Host", "proxy.local")
                .add("Connection", "keep-alive")
                .add("Proxy-Authorization", "Basic xyz");

        ProxyResponse response = forwarder.forward(getRequest(base + "/page?q=1", headers));

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getHeaders().first("content-type")).isEqualTo("text/html");
        assertThat(response.getRequestUrl()).isEqualTo(base + "/page?q=1");
        assertThat(body(response)).isEqualTo("hello");

        verify(getRequestedFor(urlEqualTo("/page?q=1"))
                .withHeader("Accept", equalTo("text/html"))
                .withHeader("Host", equalTo("localhost:" + wireMockServer.port()))
                .withoutHeader("Proxy-Authorization"));
    }

    @Test
    void forward_doesNotFollowRedirects() throws Exception {
        stubFor(get(urlEqualTo("/old")).willReturn(aResponse().withStatus(302).withHeader("Location", "/new")));

        ProxyResponse response = forwarder.forward(getRequest(base + "/old", new HttpHeaderMap()));

        assertThat(response.getStatus()).isEqualTo(302);
        assertThat(response.getHeaders().first("Location")).isEqualTo("/new");
        response.getBody().close();
        verify(0, getRequestedFor(urlEqualTo("/new")));
    }

    @Test
    void forward_sendsRequestBody() throws Exception {
        stubFor(post(urlEqualTo("/submit")).willReturn(aResponse().withStatus(201)));
        byte[] payload = "name=value".getBytes(StandardCharsets.UTF_8);
        HttpHeaderMap headers = new HttpHeaderMap()
                .add("Content-Type", "application/x-www-form-urlencoded")
                .add("Content-Length", String.valueOf(payload.length));

        ProxyResponse response = forwarder.forward(new ProxyRequest("POST", resolver.resolve(base + "/submit"),
                headers, new ByteArrayInputStream(payload), payload.length));

        assertThat(response.getStatus()).isEqualTo(201);
        response.getBody().close();
        verify(postRequestedFor(urlEqualTo("/submit")).withRequestBody(equalTo("name=value")));
    }

    @Test
    void forward_shortRequestBodyIsProtocolError() {
        ProxyRequest request = new ProxyRequest("POST", resolver.resolve(base + "/submit"), new HttpHeaderMap(),
                new ByteArrayInputStream(new byte[3]), 10);

        assertThatThrownBy(() -> forwarder.forward(request)).isInstanceOf(ProtocolException.class);
        assertThat(pools.plain().inUse()).isZero();
    }

    @Test
    void forward_holdsPermitUntilBodyClosed() throws Exception {
        stubFor(get(urlEqualTo("/a")).willReturn(aResponse().withStatus(200).withBody("a")));

        ProxyResponse response = forwarder.forward(getRequest(base + "/a", new HttpHeaderMap()));
        assertThat(pools.plain().inUse()).isEqualTo(1);

        response.getBody().close();
        response.getBody().close();
        assertThat(pools.plain().inUse()).isZero();
    }

    @Test
    void forward_unreachableOriginIsUpstreamUnavailable() throws IOException {
        int closedPort;
        try (ServerSocket s = new ServerSocket(0)) {
            closedPort = s.getLocalPort();
        }

        assertThatThrownBy(() -> forwarder.forward(getRequest("http://localhost:" + closedPort + "/", new HttpHeaderMap())))
                .isInstanceOf(UpstreamUnavailableException.class);
        assertThat(registry.get("proxy.upstream.errors").counter().count()).isEqualTo(1.0);
        assertThat(pools.plain().inUse()).isZero();
    }

    @Test
    void forward_slowOriginTimesOut() {
        stubFor(get(urlEqualTo("/slow")).willReturn(aResponse().withStatus(200).withFixedDelay(5000)));

        assertThatThrownBy(() -> forwarder.forward(getRequest(base + "/slow", new HttpHeaderMap())))
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageContaining("Timed out");
    }

    @Test
    void responseHeaders_dropsHopByHopAndPseudoHeaders() {
        HttpHeaders upstream = HttpHeaders.of(Map.of(
                ":status", List.of("200"),
                "connection", List.of("close"),
                "transfer-encoding", List.of("chunked"),
                "set-cookie", List.of("a=1", "b=2")), (n, v) -> true);

        HttpHeaderMap headers = RequestForwarder.responseHeaders(upstream);

        assertThat(headers.names()).containsExactly("set-cookie");
        assertThat(headers.all("Set-Cookie")).containsExactly("a=1", "b=2");
    }
}
