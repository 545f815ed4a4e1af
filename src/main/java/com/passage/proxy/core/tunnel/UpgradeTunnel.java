package com.passage.proxy.core.tunnel;

import com.passage.proxy.core.constants.HeaderConstants;
import com.passage.proxy.core.exceptions.ProtocolException;
import com.passage.proxy.core.exceptions.UpgradeTunnelException;
import com.passage.proxy.core.exceptions.UpstreamUnavailableException;
import com.passage.proxy.core.http.HttpHeaderMap;
import com.passage.proxy.core.pool.UpstreamPool;
import com.passage.proxy.core.pool.UpstreamPools;
import com.passage.proxy.core.target.ResolvedTarget;
import com.passage.proxy.core.utils.IoUtils;
import com.passage.proxy.core.utils.LimitInputStream;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Carries protocol upgrades (WebSocket and others) to the origin.
 * <p>
 * The client's handshake is replayed on a raw connection from the target's
 * pool. If the origin answers {@code 101 Switching Protocols} its response
 * head is passed to the client and the two connections are spliced until
 * either side closes. Any other answer is passed to the client as-is and the
 * connection is closed. Tunneled bytes are never inspected.
 */
public class UpgradeTunnel {
    private static final Logger log = LoggerFactory.getLogger(UpgradeTunnel.class);

    private static final int MAX_RESPONSE_HEADERS = 100;
    private static final int SWITCHING_PROTOCOLS = 101;

    /** Client headers not replayed to the origin. */
    private static final Set<String> EXCLUDED_HEADERS;

    static {
        Set<String> excluded = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        excluded.addAll(List.of(
                HeaderConstants.HOST.getValue(),
                HeaderConstants.PROXY_AUTHORIZATION.getValue(),
                HeaderConstants.PROXY_AUTHENTICATE.getValue(),
                HeaderConstants.KEEP_ALIVE.getValue(),
                HeaderConstants.TE.getValue(),
                HeaderConstants.TRAILER.getValue(),
                "Proxy-Connection"));
        EXCLUDED_HEADERS = Collections.unmodifiableSet(excluded);
    }

    private final UpstreamPools pools;
    private final Executor executor;
    private final Counter tunnelsTotal;
    private final Counter bytesSent;
    private final Counter bytesReceived;

    /**
     * @param pools    Upstream pools, selected by target scheme.
     * @param executor Executor for the client-to-origin copy task.
     * @param registry Registry for tunnel and traffic counters.
     */
    public UpgradeTunnel(UpstreamPools pools, Executor executor, MeterRegistry registry) {
        this.pools = pools;
        this.executor = executor;
        this.tunnelsTotal = Counter.builder("proxy.tunnels.total")
                .description("Upgrade tunnels established")
                .register(registry);
        this.bytesSent = Counter.builder("proxy.traffic.bytes.sent")
                .description("Total bytes sent to target")
                .register(registry);
        this.bytesReceived = Counter.builder("proxy.traffic.bytes.received")
                .description("Total bytes received from target")
                .register(registry);
    }

    /**
     * Whether a request asks for a protocol upgrade.
     *
     * @param headers Inbound request headers.
     * @return {@code true} if {@code Upgrade} is present and {@code Connection}
     *         lists the {@code upgrade} token.
     */
    public static boolean isUpgradeRequest(HttpHeaderMap headers) {
        if (!headers.contains(HeaderConstants.UPGRADE.getValue())) {
            return false;
        }
        for (String value : headers.all(HeaderConstants.CONNECTION.getValue())) {
            for (String token : value.split(",")) {
                if ("upgrade".equals(token.trim().toLowerCase(Locale.ROOT))) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Runs a tunnel to completion on the calling thread. The client connection
     * must not be reused afterwards.
     *
     * @param client    The client connection.
     * @param clientIn  Buffered client input positioned after the request head.
     * @param clientOut Client output.
     * @param method    Request method.
     * @param target    Resolved origin.
     * @param headers   Client request headers.
     * @return The status the origin answered with.
     * @throws UpstreamUnavailableException if no pool slot is free in time.
     * @throws UpgradeTunnelException       if the origin cannot be reached or its
     *                                      handshake answer cannot be read; nothing
     *                                      has been written to the client in that case.
     */
    public int open(Socket client, InputStream clientIn, OutputStream clientOut, String method,
            ResolvedTarget target, HttpHeaderMap headers) {
        UpstreamPool pool = pools.forTarget(target);
        UpstreamPool.Permit permit = pool.acquire();

        Socket upstream;
        try {
            upstream = pool.openSocket(target.host(), target.port());
        } catch (IOException e) {
            permit.close();
            throw new UpgradeTunnelException("Cannot connect to " + target.href() + ": " + e.getMessage(), e);
        }

        UpgradeSession session;
        List<String> responseHead;
        int status;
        try {
            InputStream upstreamIn = new BufferedInputStream(upstream.getInputStream());
            OutputStream upstreamOut = upstream.getOutputStream();
            session = new UpgradeSession(client, clientIn, clientOut, upstream, upstreamIn, upstreamOut, permit);
            writeHandshake(upstreamOut, method, target, headers);
            responseHead = readResponseHead(upstreamIn);
            status = parseStatus(responseHead.get(0));
        } catch (IOException | ProtocolException e) {
            IoUtils.closeQuietly(upstream, "upstream tunnel socket");
            permit.close();
            throw new UpgradeTunnelException("Upgrade handshake with " + target.href() + " failed: "
                    + e.getMessage(), e);
        }

        try {
            writeHead(clientOut, responseHead);
            if (status == SWITCHING_PROTOCOLS) {
                splice(session, target);
            } else {
                log.debug("Upgrade to {} refused with status {}", target.href(), status);
                relayBody(session, responseHead);
            }
        } catch (IOException e) {
            UpgradeTunnelException failure = new UpgradeTunnelException(
                    "Tunnel to " + target.href() + " broke: " + e.getMessage(), e);
            log.debug("{}", failure.getMessage(), failure);
        } finally {
            session.close();
        }
        return status;
    }

    private void splice(UpgradeSession session, ResolvedTarget target) throws IOException {
        session.disableReadTimeouts();
        tunnelsTotal.increment();
        log.debug("Tunnel established to {}", target.href());
        IoUtils.relay(session.getClientIn(), session.getClientOut(), session.getUpstreamIn(),
                session.getUpstreamOut(), executor, bytesSent, bytesReceived, session::close);
        log.debug("Tunnel to {} closed", target.href());
    }

    private void relayBody(UpgradeSession session, List<String> responseHead) throws IOException {
        long length = contentLength(responseHead);
        InputStream body = length >= 0
                ? new LimitInputStream(session.getUpstreamIn(), length)
                : session.getUpstreamIn();
        IoUtils.transfer(body, session.getClientOut(), bytesReceived);
    }

    private static void writeHandshake(OutputStream out, String method, ResolvedTarget target,
            HttpHeaderMap headers) throws IOException {
        StringBuilder head = new StringBuilder(256);
        head.append(method).append(' ').append(target.requestTarget()).append(" HTTP/1.1\r\n");
        head.append(HeaderConstants.HOST.getValue()).append(": ").append(target.hostHeader()).append("\r\n");
        headers.forEach((name, value) -> {
            if (!EXCLUDED_HEADERS.contains(name)) {
                head.append(name).append(": ").append(value).append("\r\n");
            }
        });
        head.append("\r\n");
        OutputStream buffered = new BufferedOutputStream(out);
        IoUtils.writeAscii(buffered, head.toString());
        buffered.flush();
    }

    private static List<String> readResponseHead(InputStream in) throws IOException {
        String statusLine = IoUtils.readLine(in);
        if (statusLine == null || !statusLine.startsWith("HTTP/")) {
            throw new ProtocolException("Invalid status line from upstream: " + statusLine);
        }
        List<String> head = new ArrayList<>();
        head.add(statusLine);
        String line;
        while ((line = IoUtils.readLine(in)) != null && !line.isEmpty()) {
            if (head.size() > MAX_RESPONSE_HEADERS) {
                throw new ProtocolException("Too many upstream headers (exceeds limit of "
                        + MAX_RESPONSE_HEADERS + ")");
            }
            head.add(line);
        }
        if (line == null) {
            throw new ProtocolException("Upstream closed the connection inside the response head");
        }
        return head;
    }

    private static void writeHead(OutputStream out, List<String> head) throws IOException {
        StringBuilder sb = new StringBuilder(256);
        for (String line : head) {
            sb.append(line).append("\r\n");
        }
        sb.append("\r\n");
        IoUtils.writeAscii(out, sb.toString());
        out.flush();
    }

    static int parseStatus(String statusLine) {
        String[] parts = statusLine.split(" ", 3);
        if (parts.length < 2) {
            throw new ProtocolException("Invalid status line from upstream: " + statusLine);
        }
        try {
            return Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new ProtocolException("Invalid status code from upstream: " + statusLine, e);
        }
    }

    private static long contentLength(List<String> head) {
        for (int i = 1; i < head.size(); i++) {
            String line = head.get(i);
            int idx = line.indexOf(':');
            if (idx != -1 && HeaderConstants.CONTENT_LENGTH.getValue().equalsIgnoreCase(line.substring(0, idx).trim())) {
                try {
                    return Long.parseLong(line.substring(idx + 1).trim());
                } catch (NumberFormatException e) {
                    return -1;
                }
            }
        }
        return -1;
    }
}
