package com.passage.proxy.core.proxy;

import com.passage.proxy.config.PassageProperties;
import com.passage.proxy.core.constants.HeaderConstants;
import com.passage.proxy.core.exceptions.InvalidTargetUrlException;
import com.passage.proxy.core.exceptions.ProtocolException;
import com.passage.proxy.core.exceptions.ProxyException;
import com.passage.proxy.core.exceptions.UpgradeTunnelException;
import com.passage.proxy.core.exceptions.UpstreamUnavailableException;
import com.passage.proxy.core.forward.RequestForwarder;
import com.passage.proxy.core.http.HttpHeaderMap;
import com.passage.proxy.core.http.ProxyRequest;
import com.passage.proxy.core.http.ProxyResponse;
import com.passage.proxy.core.pool.UpstreamPools;
import com.passage.proxy.core.rewrite.RewritePipeline;
import com.passage.proxy.core.services.AccessLogService;
import com.passage.proxy.core.target.ResolvedTarget;
import com.passage.proxy.core.target.TargetResolver;
import com.passage.proxy.core.tunnel.UpgradeTunnel;
import com.passage.proxy.core.utils.ChunkedInputStream;
import com.passage.proxy.core.utils.ChunkedOutputStream;
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
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * HTTP/1.1 front end of the web proxy.
 * <p>
 * Requests for {@code <prefix><absolute URL>} are resolved, forwarded through
 * the upstream pools, passed through the rewrite pipeline and streamed back.
 * Upgrade requests under the prefix are handed to the {@link UpgradeTunnel}.
 * {@code GET /} serves the landing page; everything else is 404. Connections
 * are kept alive between requests unless the client or the configuration
 * says otherwise.
 */
public class WebProxyServer extends AbstractProxyServer {

    private static final int MAX_HTTP_HEADERS = 100;

    private static final int HTTP_OK = 200;
    private static final int HTTP_BAD_REQUEST = 400;
    private static final int HTTP_NOT_FOUND = 404;
    private static final int HTTP_METHOD_NOT_ALLOWED = 405;
    private static final int HTTP_INTERNAL_ERROR = 500;
    private static final int HTTP_BAD_GATEWAY = 502;

    /** Standard HTTP reason phrases. */
    private static final Map<Integer, String> REASON_PHRASES = Map.ofEntries(
            Map.entry(100, "Continue"), Map.entry(101, "Switching Protocols"),
            Map.entry(200, "OK"), Map.entry(201, "Created"), Map.entry(202, "Accepted"),
            Map.entry(204, "No Content"), Map.entry(206, "Partial Content"),
            Map.entry(301, "Moved Permanently"), Map.entry(302, "Found"), Map.entry(303, "See Other"),
            Map.entry(304, "Not Modified"), Map.entry(307, "Temporary Redirect"),
            Map.entry(308, "Permanent Redirect"),
            Map.entry(400, "Bad Request"), Map.entry(401, "Unauthorized"), Map.entry(403, "Forbidden"),
            Map.entry(404, "Not Found"), Map.entry(405, "Method Not Allowed"),
            Map.entry(408, "Request Timeout"), Map.entry(410, "Gone"), Map.entry(413, "Payload Too Large"),
            Map.entry(416, "Range Not Satisfiable"), Map.entry(429, "Too Many Requests"),
            Map.entry(500, "Internal Server Error"), Map.entry(502, "Bad Gateway"),
            Map.entry(503, "Service Unavailable"), Map.entry(504, "Gateway Timeout"));

    private final String proxyPrefix;
    private final TargetResolver resolver;
    private final RequestForwarder forwarder;
    private final RewritePipeline pipeline;
    private final UpgradeTunnel tunnel;
    private final LandingPage landingPage;
    private final Counter requestsTotal;
    private final Counter bytesReceived;

    /**
     * @param properties Validated configuration.
     * @param pools      Upstream pools, owned by the caller.
     * @param accessLog  Access log.
     * @param registry   Meter registry.
     */
    public WebProxyServer(PassageProperties properties, UpstreamPools pools, AccessLogService accessLog,
            MeterRegistry registry) {
        super(properties.getServer(), accessLog, registry);
        this.proxyPrefix = properties.getServer().getProxyPrefix();
        this.resolver = new TargetResolver(properties.getUpstream().isStripExplicitPorts(), registry);
        this.forwarder = new RequestForwarder(pools, properties.getUpstream().getTimeout(), registry);
        this.pipeline = RewritePipeline.standard(proxyPrefix, registry);
        this.tunnel = new UpgradeTunnel(pools, executor, registry);
        this.landingPage = LandingPage.load(proxyPrefix);

        this.requestsTotal = Counter.builder("proxy.http.requests.total")
                .description("Total number of HTTP requests")
                .register(registry);
        this.bytesReceived = Counter.builder("proxy.traffic.bytes.received")
                .description("Total bytes received from target")
                .register(registry);
    }

    @Override
    protected String getProxyName() {
        return "HTTP";
    }

    @Override
    public void stop() {
        super.stop();
        registry.remove(requestsTotal);
    }

    /**
     * Request loop for one client connection.
     */
    @Override
    protected void handleClient(Socket client) {
        String remoteAddr = client.getInetAddress().getHostAddress();
        try (client) {
            InputStream in = new BufferedInputStream(client.getInputStream());
            OutputStream out = new BufferedOutputStream(client.getOutputStream());

            while (!client.isClosed() && isRunning() && processNextRequest(client, in, out, remoteAddr)) {
                // keep-alive: next request on the same connection
            }
        } catch (ProtocolException e) {
            log.warn("HTTP protocol error from {}: {}", remoteAddr, e.getMessage());
        } catch (ProxyException e) {
            log.error("HTTP proxy error for {}: {}", remoteAddr, e.getMessage());
        } catch (IOException e) {
            log.debug("Connection from {} ended: {}", remoteAddr, e.getMessage());
        }
    }

    private boolean processNextRequest(Socket client, InputStream in, OutputStream out, String remoteAddr)
            throws IOException {
        String requestLine = readRequestLine(client, in, remoteAddr);
        if (requestLine == null) {
            return false;
        }
        requestsTotal.increment();
        long startNanos = System.nanoTime();

        String[] parts = requestLine.split(" ");
        if (parts.length != 3 || !parts[2].startsWith("HTTP/")) {
            writeErrorResponse(out, HTTP_BAD_REQUEST, "Malformed request line");
            accessLog.logRequest(remoteAddr, "-", requestLine, HTTP_BAD_REQUEST, 0, elapsedMs(startNanos));
            return false;
        }
        String method = parts[0];
        String rawUri = parts[1];

        Exchange exchange = new Exchange();
        InputStream body = null;
        try {
            HttpHeaderMap headers = readHeaders(in);
            exchange.keepAlive = wantsKeepAlive(parts[2], headers);
            long bodyLength = requestBodyLength(headers);
            body = openBody(in, bodyLength);
            route(client, in, out, method, rawUri, headers, body, bodyLength, exchange);
        } catch (ProtocolException e) {
            log.warn("Bad request from {}: {}", remoteAddr, e.getMessage());
            writeError(out, exchange, HTTP_BAD_REQUEST, e.getMessage());
        } catch (ProxyException e) {
            log.error("Failed to handle {} {} from {}: {}", method, rawUri, remoteAddr, e.getMessage(), e);
            writeError(out, exchange, HTTP_INTERNAL_ERROR, e.getMessage());
        } finally {
            if (body != null && exchange.keepAlive) {
                try {
                    body.close();
                } catch (IOException | ProtocolException e) {
                    log.debug("Could not skip request body from {}: {}", remoteAddr, e.getMessage());
                    exchange.keepAlive = false;
                }
            }
            accessLog.logRequest(remoteAddr, method, rawUri, exchange.status, exchange.bytes, elapsedMs(startNanos));
        }
        return exchange.keepAlive;
    }

    private void route(Socket client, InputStream in, OutputStream out, String method, String rawUri,
            HttpHeaderMap headers, InputStream body, long bodyLength, Exchange exchange) throws IOException {
        if ("CONNECT".equalsIgnoreCase(method)) {
            writeError(out, exchange, HTTP_METHOD_NOT_ALLOWED, "CONNECT is not supported");
            return;
        }
        if (rawUri.startsWith(proxyPrefix)) {
            handleProxy(client, in, out, method, rawUri.substring(proxyPrefix.length()), headers, body,
                    bodyLength, exchange);
            return;
        }
        if (isLandingPath(rawUri)) {
            if ("GET".equalsIgnoreCase(method) || "HEAD".equalsIgnoreCase(method)) {
                serveLandingPage(out, method, exchange);
            } else {
                writeError(out, exchange, HTTP_METHOD_NOT_ALLOWED, method + " is not allowed on " + rawUri);
            }
            return;
        }
        writeError(out, exchange, HTTP_NOT_FOUND, "Not Found: " + rawUri);
    }

    private void handleProxy(Socket client, InputStream in, OutputStream out, String method, String remainder,
            HttpHeaderMap headers, InputStream body, long bodyLength, Exchange exchange) throws IOException {
        ResolvedTarget target;
        try {
            target = resolver.resolve(remainder);
        } catch (InvalidTargetUrlException e) {
            log.debug("Rejected target '{}': {}", remainder, e.getMessage());
            writeError(out, exchange, HTTP_BAD_REQUEST, e.getMessage());
            return;
        }
        accessLog.logTarget(target.href());

        if (UpgradeTunnel.isUpgradeRequest(headers)) {
            exchange.keepAlive = false;
            try {
                exchange.status = tunnel.open(client, in, out, method, target, headers);
            } catch (UpgradeTunnelException | UpstreamUnavailableException e) {
                log.warn("Upgrade tunnel to {} failed: {}", target.href(), e.getMessage());
                writeError(out, exchange, HTTP_BAD_GATEWAY, e.getMessage());
            }
            return;
        }

        ProxyResponse response;
        try {
            response = forwarder.forward(new ProxyRequest(method, target, headers, body, bodyLength));
        } catch (UpstreamUnavailableException e) {
            writeError(out, exchange, HTTP_BAD_GATEWAY, e.getMessage());
            return;
        } catch (InvalidTargetUrlException e) {
            writeError(out, exchange, HTTP_BAD_REQUEST, e.getMessage());
            return;
        }

        response = pipeline.apply(response, method);
        exchange.status = response.getStatus();
        exchange.bytes = writeResponse(out, response, method, exchange);
    }

    /**
     * Streams a response to the client. Closing the upstream body, which
     * happens on every path out of this method, gives the pool slot back.
     */
    private long writeResponse(OutputStream out, ProxyResponse response, String method, Exchange exchange)
            throws IOException {
        int status = response.getStatus();
        HttpHeaderMap headers = response.getHeaders();
        boolean bodyAllowed = !"HEAD".equalsIgnoreCase(method) && status >= HTTP_OK && status != 204 && status != 304;

        long contentLength = parseLength(headers.first(HeaderConstants.CONTENT_LENGTH.getValue()));
        boolean chunked = bodyAllowed && contentLength < 0;
        if (chunked) {
            headers.remove(HeaderConstants.CONTENT_LENGTH.getValue());
            headers.set(HeaderConstants.TRANSFER_ENCODING.getValue(), "chunked");
        }
        headers.set(HeaderConstants.CONNECTION.getValue(), exchange.keepAlive ? "keep-alive" : "close");

        try (InputStream body = response.getBody()) {
            writeHead(out, status, headers);
            if (!bodyAllowed) {
                out.flush();
                return 0;
            }
            if (chunked) {
                ChunkedOutputStream chunkedOut = new ChunkedOutputStream(out);
                long copied = IoUtils.transfer(body, chunkedOut, bytesReceived);
                chunkedOut.close();
                out.flush();
                return copied;
            }
            long copied = IoUtils.transfer(new LimitInputStream(body, contentLength), out, bytesReceived);
            if (copied < contentLength) {
                exchange.keepAlive = false;
                throw new IOException("Upstream body ended after " + copied + " of " + contentLength + " bytes");
            }
            return copied;
        }
    }

    private void serveLandingPage(OutputStream out, String method, Exchange exchange) throws IOException {
        HttpHeaderMap headers = new HttpHeaderMap();
        headers.set(HeaderConstants.CONTENT_TYPE.getValue(), LandingPage.CONTENT_TYPE);
        headers.set(HeaderConstants.CONTENT_LENGTH.getValue(), String.valueOf(landingPage.length()));
        headers.set(HeaderConstants.CONNECTION.getValue(), exchange.keepAlive ? "keep-alive" : "close");
        writeHead(out, HTTP_OK, headers);
        if (!"HEAD".equalsIgnoreCase(method)) {
            out.write(landingPage.content());
            exchange.bytes = landingPage.length();
        }
        out.flush();
        exchange.status = HTTP_OK;
    }

    private static void writeHead(OutputStream out, int status, HttpHeaderMap headers) throws IOException {
        StringBuilder head = new StringBuilder(512);
        head.append("HTTP/1.1 ").append(status).append(' ')
                .append(REASON_PHRASES.getOrDefault(status, "Unknown")).append("\r\n");
        headers.forEach((name, value) -> head.append(name).append(": ").append(value).append("\r\n"));
        head.append("\r\n");
        IoUtils.writeAscii(out, head.toString());
    }

    private void writeError(OutputStream out, Exchange exchange, int status, String message) throws IOException {
        exchange.status = status;
        exchange.keepAlive = false;
        exchange.bytes = writeErrorResponse(out, status, message);
    }

    /**
     * Writes a plain-text error response and asks the client to close.
     *
     * @return number of body bytes written
     */
    static int writeErrorResponse(OutputStream out, int status, String message) throws IOException {
        String line = message == null ? "" : message.replace('\r', ' ').replace('\n', ' ');
        byte[] body = (line + "\n").getBytes(StandardCharsets.UTF_8);
        String head = "HTTP/1.1 " + status + " " + REASON_PHRASES.getOrDefault(status, "Error") + "\r\n"
                + "Content-Type: text/plain; charset=utf-8\r\n"
                + "Content-Length: " + body.length + "\r\n"
                + "Connection: close\r\n\r\n";
        IoUtils.writeAscii(out, head);
        out.write(body);
        out.flush();
        return body.length;
    }

    private String readRequestLine(Socket client, InputStream in, String remoteAddr) {
        idleSockets.add(client);
        try {
            String line = IoUtils.readLine(in);
            // tolerate one stray CRLF between pipelined requests
            if (line != null && line.isEmpty()) {
                line = IoUtils.readLine(in);
            }
            return line == null || line.isEmpty() ? null : line;
        } catch (IOException e) {
            log.debug("Error reading request line from {}: {}", remoteAddr, e.getMessage());
            return null;
        } finally {
            idleSockets.remove(client);
        }
    }

    private HttpHeaderMap readHeaders(InputStream in) throws IOException {
        HttpHeaderMap headers = new HttpHeaderMap();
        String line;
        int headerCount = 0;
        while ((line = IoUtils.readLine(in)) != null && !line.isEmpty()) {
            if (++headerCount > MAX_HTTP_HEADERS) {
                throw new ProtocolException("Too many HTTP headers (exceeds limit of " + MAX_HTTP_HEADERS + ")");
            }
            int idx = line.indexOf(':');
            if (idx > 0) {
                headers.add(line.substring(0, idx).trim(), line.substring(idx + 1).trim());
            }
        }
        if (line == null) {
            throw new ProtocolException("Connection closed inside the request headers");
        }
        return headers;
    }

    private boolean wantsKeepAlive(String version, HttpHeaderMap headers) {
        if (!config.isKeepAlive()) {
            return false;
        }
        String connection = headers.first(HeaderConstants.CONNECTION.getValue());
        String tokens = connection == null ? "" : connection.toLowerCase(Locale.ROOT);
        if ("HTTP/1.0".equals(version)) {
            return tokens.contains("keep-alive");
        }
        return !tokens.contains("close");
    }

    /**
     * @return declared body length, {@link ProxyRequest#UNKNOWN_LENGTH} for a
     *         chunked body, 0 when there is none
     */
    private static long requestBodyLength(HttpHeaderMap headers) {
        String transferEncoding = headers.first(HeaderConstants.TRANSFER_ENCODING.getValue());
        if (transferEncoding != null) {
            if (!transferEncoding.toLowerCase(Locale.ROOT).trim().endsWith("chunked")) {
                throw new ProtocolException("Unsupported transfer encoding: " + transferEncoding);
            }
            return ProxyRequest.UNKNOWN_LENGTH;
        }
        String contentLength = headers.first(HeaderConstants.CONTENT_LENGTH.getValue());
        if (contentLength == null) {
            return 0;
        }
        long length = parseLength(contentLength);
        if (length < 0) {
            throw new ProtocolException("Invalid Content-Length: " + contentLength);
        }
        return length;
    }

    private static InputStream openBody(InputStream in, long bodyLength) {
        if (bodyLength == ProxyRequest.UNKNOWN_LENGTH) {
            return new ChunkedInputStream(in);
        }
        return bodyLength > 0 ? new LimitInputStream(in, bodyLength) : null;
    }

    private static long parseLength(String value) {
        if (value == null) {
            return -1;
        }
        try {
            long length = Long.parseLong(value.trim());
            return length >= 0 ? length : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private boolean isLandingPath(String rawUri) {
        int query = rawUri.indexOf('?');
        String path = query == -1 ? rawUri : rawUri.substring(0, query);
        return "/".equals(path) || "/index.html".equals(path);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /** Outcome of one request, filled in while it is handled. */
    private static final class Exchange {
        private int status = HTTP_OK;
        private long bytes;
        private boolean keepAlive;
    }
}
