package com.passage.proxy.core.tunnel;

import com.passage.proxy.config.PassageProperties;
import com.passage.proxy.core.exceptions.ProtocolException;
import com.passage.proxy.core.http.HttpHeaderMap;
import com.passage.proxy.core.pool.UpstreamPools;
import com.passage.proxy.core.proxy.WebProxyServer;
import com.passage.proxy.core.services.AccessLogService;
import com.passage.proxy.core.utils.IoUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class UpgradeTunnelTest {

    private ServerSocket backend;
    private WebProxyServer proxyServer;
    private UpstreamPools pools;
    private MeterRegistry registry;
    private int proxyPort;
    private final List<String> handshakeLines = new CopyOnWriteArrayList<>();
    private volatile String backendAnswer;

    @BeforeEach
    void setUp() throws IOException {
        backendAnswer = "HTTP/1.1 101 Switching Protocols\r\nUpgrade: websocket\r\nConnection: Upgrade\r\n\r\n";
        backend = new ServerSocket(0);
        Thread backendThread = new Thread(this::runBackend);
        backendThread.setDaemon(true);
        backendThread.start();

        PassageProperties props = new PassageProperties();
        props.getServer().setPort(0);
        props.getServer().setShutdownGracePeriod(1000);
        props.getUpstream().setStripExplicitPorts(false);
        props.validate();

        registry = new SimpleMeterRegistry();
        pools = new UpstreamPools(props.getUpstream(), registry);
        proxyServer = new WebProxyServer(props, pools, new AccessLogService(props.getLogging()), registry);
        Thread t = new Thread(proxyServer::start);
        t.setDaemon(true);
        t.start();
        assertThat(proxyServer.awaitBind(10, TimeUnit.SECONDS)).isTrue();
        proxyPort = proxyServer.getPort();
    }

    @AfterEach
    void tearDown() throws IOException {
        if (proxyServer != null)
            proxyServer.stop();
        if (pools != null)
            pools.close();
        backend.close();
    }

    /** Records the handshake, answers with {@link #backendAnswer}, then echoes. */
    private void runBackend() {
        while (!backend.isClosed()) {
            try (Socket s = backend.accept()) {
                InputStream in = s.getInputStream();
                OutputStream out = s.getOutputStream();
                String line;
                while ((line = IoUtils.readLine(in)) != null && !line.isEmpty()) {
                    handshakeLines.add(line);
                }
                out.write(backendAnswer.getBytes(StandardCharsets.ISO_8859_1));
                out.flush();
                if (backendAnswer.startsWith("HTTP/1.1 101")) {
                    IoUtils.transfer(in, out, null);
                }
            } catch (IOException e) {
                // backend closed
            }
        }
    }

    private static String readHead(InputStream in) throws IOException {
        StringBuilder sb = new StringBuilder();
        String line;
        while ((line = IoUtils.readLine(in)) != null && !line.isEmpty()) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    private String upgradeRequest(int port) {
        return "GET /proxy/http://localhost:" + port + "/chat?room=1 HTTP/1.1\r\n"
                + "Host: localhost:" + proxyPort + "\r\n"
                + "Upgrade: websocket\r\n"
                + "Connection: keep-alive, Upgrade\r\n"
                + "Sec-WebSocket-Key: dGhlIHNhbXBsZSBub25jZQ==\r\n"
                + "Proxy-Authorization: Basic secret\r\n\r\n";
    }

    @Test
    void upgrade_splicesBothDirections() throws Exception {
        try (Socket socket = new Socket("localhost", proxyPort)) {
            socket.setSoTimeout(5000);
            OutputStream out = socket.getOutputStream();
            InputStream in = socket.getInputStream();
            out.write(upgradeRequest(backend.getLocalPort()).getBytes(StandardCharsets.ISO_8859_1));
            out.flush();

            assertThat(readHead(in)).startsWith("HTTP/1.1 101 Switching Protocols").contains("Upgrade: websocket");

            out.write("ping".getBytes(StandardCharsets.ISO_8859_1));
            out.flush();
            assertThat(new String(in.readNBytes(4), StandardCharsets.ISO_8859_1)).isEqualTo("ping");
        }

        assertThat(handshakeLines).contains("GET /chat?room=1 HTTP/1.1", "Host: localhost:" + backend.getLocalPort(),
                "Upgrade: websocket", "Sec-WebSocket-Key: dGhlIHNhbXBsZSBub25jZQ==");
        assertThat(handshakeLines).noneMatch(l -> l.startsWith("Proxy-Authorization"));
        assertThat(registry.get("proxy.tunnels.total").counter().count()).isEqualTo(1.0);
        await().atMost(Duration.ofSeconds(5)).until(() -> pools.plain().inUse() == 0);
    }

    @Test
    void refusedUpgrade_isRelayedAndClosed() throws Exception {
        backendAnswer = "HTTP/1.1 403 Forbidden\r\nContent-Length: 6\r\n\r\ndenied";

        try (Socket socket = new Socket("localhost", proxyPort)) {
            socket.setSoTimeout(5000);
            socket.getOutputStream().write(upgradeRequest(backend.getLocalPort()).getBytes(StandardCharsets.ISO_8859_1));
            socket.getOutputStream().flush();

            String response = new String(socket.getInputStream().readAllBytes(), StandardCharsets.ISO_8859_1);
            assertThat(response).startsWith("HTTP/1.1 403 Forbidden").endsWith("denied");
        }
        assertThat(registry.get("proxy.tunnels.total").counter().count()).isZero();
    }

    @Test
    void unreachableOrigin_returns502() throws Exception {
        int closedPort;
        try (ServerSocket s = new ServerSocket(0)) {
            closedPort = s.getLocalPort();
        }

        try (Socket socket = new Socket("localhost", proxyPort)) {
            socket.setSoTimeout(5000);
            socket.getOutputStream().write(upgradeRequest(closedPort).getBytes(StandardCharsets.ISO_8859_1));
            socket.getOutputStream().flush();

            String response = new String(socket.getInputStream().readAllBytes(), StandardCharsets.ISO_8859_1);
            assertThat(response).startsWith("HTTP/1.1 502 Bad Gateway");
        }
        assertThat(pools.plain().inUse()).isZero();
    }

    @Test
    void isUpgradeRequest_needsUpgradeTokenInConnection() {
        assertThat(UpgradeTunnel.isUpgradeRequest(new HttpHeaderMap()
                .add("Upgrade", "websocket").add("Connection", "keep-alive, Upgrade"))).isTrue();
        assertThat(UpgradeTunnel.isUpgradeRequest(new HttpHeaderMap()
                .add("Upgrade", "websocket").add("Connection", "keep-alive"))).isFalse();
        assertThat(UpgradeTunnel.isUpgradeRequest(new HttpHeaderMap().add("Connection", "upgrade"))).isFalse();
    }

    @Test
    void parseStatus_readsCode() {
        assertThat(UpgradeTunnel.parseStatus("HTTP/1.1 101 Switching Protocols")).isEqualTo(101);
        assertThat(UpgradeTunnel.parseStatus("HTTP/1.1 204")).isEqualTo(204);
        assertThatThrownBy(() -> UpgradeTunnel.parseStatus("HTTP/1.1")).isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> UpgradeTunnel.parseStatus("HTTP/1.1 abc")).isInstanceOf(ProtocolException.class);
    }
}
