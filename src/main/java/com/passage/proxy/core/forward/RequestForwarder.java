package com.passage.proxy.core.forward;

import com.passage.proxy.core.constants.HeaderConstants;
import com.passage.proxy.core.exceptions.InvalidTargetUrlException;
import com.passage.proxy.core.exceptions.ProtocolException;
import com.passage.proxy.core.exceptions.UpstreamUnavailableException;
import com.passage.proxy.core.http.HttpHeaderMap;
import com.passage.proxy.core.http.ProxyRequest;
import com.passage.proxy.core.http.ProxyResponse;
import com.passage.proxy.core.pool.UpstreamPool;
import com.passage.proxy.core.pool.UpstreamPools;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends a resolved request to its origin through the matching upstream pool
 * and returns the raw response.
 * <p>
 * The upstream slot stays reserved while the response body is open and is
 * given back exactly once when the body is closed, whether it was fully read
 * or abandoned. Redirects are never followed.
 */
public class RequestForwarder {
    private static final Logger log = LoggerFactory.getLogger(RequestForwarder.class);

    /** Request bodies smaller than this are buffered; larger ones are streamed. */
    static final int LARGE_BODY_THRESHOLD = 64 * 1024;

    private static final String PROXY_CONNECTION = "Proxy-Connection";

    /** Headers that must not be copied from the client onto the upstream request. */
    private static final Set<String> EXCLUDED_REQUEST_HEADERS;

    /** Hop-by-hop headers, removed from upstream responses. */
    public static final Set<String> HOP_BY_HOP_HEADERS;

    static {
        Set<String> hopByHop = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        hopByHop.addAll(List.of(
                HeaderConstants.CONNECTION.getValue(),
                HeaderConstants.KEEP_ALIVE.getValue(),
                HeaderConstants.PROXY_AUTHENTICATE.getValue(),
                HeaderConstants.PROXY_AUTHORIZATION.getValue(),
                HeaderConstants.TE.getValue(),
                HeaderConstants.TRAILER.getValue(),
                HeaderConstants.TRANSFER_ENCODING.getValue(),
                HeaderConstants.UPGRADE.getValue(),
                PROXY_CONNECTION));
        HOP_BY_HOP_HEADERS = Collections.unmodifiableSet(hopByHop);

        Set<String> excluded = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        excluded.addAll(hopByHop);
        excluded.addAll(List.of(
                HeaderConstants.HOST.getValue(),
                HeaderConstants.CONTENT_LENGTH.getValue(),
                HeaderConstants.EXPECT.getValue()));
        EXCLUDED_REQUEST_HEADERS = Collections.unmodifiableSet(excluded);
    }

    private final UpstreamPools pools;
    private final Duration timeout;
    private final Counter upstreamErrors;

    /**
     * @param pools     Upstream pools, selected by target scheme.
     * @param timeoutMs Time allowed for the origin to start answering.
     * @param registry  Registry for the upstream error counter.
     */
    public RequestForwarder(UpstreamPools pools, int timeoutMs, MeterRegistry registry) {
        this.pools = pools;
        this.timeout = Duration.ofMillis(timeoutMs);
        this.upstreamErrors = Counter.builder("proxy.upstream.errors")
                .description("Requests that failed to reach the origin")
                .register(registry);
    }

    /**
     * Forwards a request and waits for the response head.
     *
     * @param request The resolved inbound request.
     * @return The origin's response; the caller must close its body.
     * @throws UpstreamUnavailableException if the origin cannot be reached, times
     *                                      out, or no pool slot frees up.
     * @throws ProtocolException            if the client body ends early.
     */
    public ProxyResponse forward(ProxyRequest request) {
        UpstreamPool pool = pools.forTarget(request.getTarget());
        UpstreamPool.Permit permit = pool.acquire();
        String url = request.getTargetUrl();

        HttpResponse<InputStream> response;
        try {
            HttpRequest upstreamRequest = buildRequest(request);
            log.debug("Forwarding {} {} via pool '{}'", request.getMethod(), url, pool.getName());
            response = pool.client().send(upstreamRequest, HttpResponse.BodyHandlers.ofInputStream());
        } catch (HttpConnectTimeoutException e) {
            permit.close();
            throw upstreamFailure("Connect timeout to " + url, e);
        } catch (HttpTimeoutException e) {
            permit.close();
            throw upstreamFailure("Timed out waiting for " + url, e);
        } catch (ConnectException e) {
            permit.close();
            throw upstreamFailure("Cannot connect to " + url, e);
        } catch (IOException e) {
            permit.close();
            throw upstreamFailure("Upstream request to " + url + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            permit.close();
            Thread.currentThread().interrupt();
            throw upstreamFailure("Interrupted while waiting for " + url, e);
        } catch (RuntimeException e) {
            permit.close();
            throw e;
        }

        HttpHeaderMap headers = responseHeaders(response.headers());
        return new ProxyResponse(response.statusCode(), headers, new PermitReleasingInputStream(response.body(), permit),
                url);
    }

    private HttpRequest buildRequest(ProxyRequest request) {
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder()
                    .uri(request.getTarget().uri())
                    .timeout(timeout)
                    .method(request.getMethod(), bodyPublisher(request));
        } catch (IllegalArgumentException e) {
            throw new InvalidTargetUrlException("Cannot build upstream request: " + e.getMessage(), e);
        }

        request.getHeaders().forEach((name, value) -> {
            if (EXCLUDED_REQUEST_HEADERS.contains(name)) {
                return;
            }
            try {
                builder.header(name, value);
            } catch (IllegalArgumentException e) {
                log.debug("Dropping request header {}: {}", name, e.getMessage());
            }
        });
        return builder.build();
    }

    private static HttpRequest.BodyPublisher bodyPublisher(ProxyRequest request) {
        if (!request.hasBody()) {
            return HttpRequest.BodyPublishers.noBody();
        }
        InputStream body = request.getBody();
        long length = request.getBodyLength();
        if (length == ProxyRequest.UNKNOWN_LENGTH) {
            return HttpRequest.BodyPublishers.ofInputStream(() -> body);
        }
        if (length < LARGE_BODY_THRESHOLD) {
            byte[] bytes;
            try {
                bytes = body.readNBytes((int) length);
            } catch (IOException e) {
                throw new ProtocolException("Failed to read request body: " + e.getMessage(), e);
            }
            if (bytes.length < length) {
                throw new ProtocolException("Request body ended after " + bytes.length + " of " + length + " bytes");
            }
            return HttpRequest.BodyPublishers.ofByteArray(bytes);
        }
        return HttpRequest.BodyPublishers.fromPublisher(HttpRequest.BodyPublishers.ofInputStream(() -> body),
                length);
    }

    /**
     * Copies upstream response headers, leaving out hop-by-hop headers and
     * HTTP/2 pseudo-headers.
     *
     * @param upstream Headers as received.
     * @return A new header map.
     */
    static HttpHeaderMap responseHeaders(HttpHeaders upstream) {
        HttpHeaderMap headers = new HttpHeaderMap();
        upstream.map().forEach((name, values) -> {
            if (name.startsWith(":") || HOP_BY_HOP_HEADERS.contains(name)) {
                return;
            }
            values.forEach(v -> headers.add(name, v));
        });
        return headers;
    }

    private UpstreamUnavailableException upstreamFailure(String message, Exception cause) {
        upstreamErrors.increment();
        log.warn("{}", message);
        return new UpstreamUnavailableException(message, cause);
    }

    /**
     * Response body that gives its pool slot back when closed.
     */
    static final class PermitReleasingInputStream extends FilterInputStream {
        private final UpstreamPool.Permit permit;

        PermitReleasingInputStream(InputStream in, UpstreamPool.Permit permit) {
            super(in);
            this.permit = permit;
        }

        @Override
        public void close() throws IOException {
            try {
                super.close();
            } finally {
                permit.close();
            }
        }
    }
}
