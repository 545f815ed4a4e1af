package com.passage.proxy.core.pool;

import com.passage.proxy.config.UpstreamConfig;
import com.passage.proxy.core.exceptions.UpstreamUnavailableException;
import com.passage.proxy.core.utils.IoUtils;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded set of outbound connections for one scheme.
 * <p>
 * Every forwarded request and every upgrade tunnel holds a {@link Permit}
 * for as long as its upstream connection is in use; at most
 * {@code maxConnectionsPerPool} permits exist. Callers that cannot get one
 * within the upstream timeout fail with {@link UpstreamUnavailableException}.
 * Idle keep-alive connections are reused by the pool's {@link HttpClient}.
 */
public class UpstreamPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(UpstreamPool.class);

    private final String name;
    private final boolean secure;
    private final int maxConnections;
    private final Semaphore permits;
    private final int timeout;
    private final int connectTimeout;
    private final SSLContext sslContext;
    private final boolean verifyHostnames;
    private final ExecutorService clientExecutor;
    private final HttpClient client;
    private final MeterRegistry registry;
    private final Gauge inUseGauge;

    /**
     * @param name       Pool name, used in thread names and the {@code pool} metric tag.
     * @param sslContext Context for TLS connections, or {@code null} for a plain pool.
     * @param config     Upstream settings.
     * @param registry   Registry for the in-use gauge.
     */
    public UpstreamPool(String name, SSLContext sslContext, UpstreamConfig config, MeterRegistry registry) {
        this.name = name;
        this.secure = sslContext != null;
        this.sslContext = sslContext;
        this.verifyHostnames = !config.isTrustAllCertificates();
        this.maxConnections = config.getMaxConnectionsPerPool();
        this.permits = new Semaphore(maxConnections, true);
        this.timeout = config.getTimeout();
        this.connectTimeout = config.getConnectTimeout();
        this.registry = registry;
        this.clientExecutor = Executors.newCachedThreadPool(daemonThreads("upstream-" + name));

        HttpClient.Builder builder = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(Duration.ofMillis(connectTimeout))
                .executor(clientExecutor);
        if (secure) {
            builder.sslContext(sslContext);
        }
        this.client = builder.build();

        this.inUseGauge = Gauge.builder("proxy.pool.in_use", this, UpstreamPool::inUse)
                .tag("pool", name)
                .description("Upstream connections currently in use")
                .register(registry);
    }

    /**
     * Waits up to the upstream timeout for a free connection slot.
     *
     * @return A permit that must be closed when the connection is no longer used.
     * @throws UpstreamUnavailableException if no slot frees up in time.
     */
    public Permit acquire() {
        try {
            if (!permits.tryAcquire(timeout, TimeUnit.MILLISECONDS)) {
                log.warn("Upstream pool '{}' exhausted ({} connections in use)", name, maxConnections);
                throw new UpstreamUnavailableException(
                        "No upstream connection available in pool '" + name + "' after " + timeout + " ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException("Interrupted while waiting for an upstream connection", e);
        }
        return new Permit();
    }

    /**
     * Opens a raw connection to an origin, wrapped in TLS for a secure pool.
     * Used for protocol upgrades, which the HTTP client cannot carry.
     *
     * @param host Origin host.
     * @param port Origin port.
     * @return A connected (and, for TLS, handshaken) socket.
     * @throws IOException If the connection or handshake fails.
     */
    public Socket openSocket(String host, int port) throws IOException {
        Socket plain = new Socket();
        try {
            plain.connect(new InetSocketAddress(host, port), connectTimeout);
            plain.setTcpNoDelay(true);
            plain.setSoTimeout(timeout);
            if (!secure) {
                return plain;
            }
            SSLSocket ssl = (SSLSocket) sslContext.getSocketFactory().createSocket(plain, host, port, true);
            if (verifyHostnames) {
                SSLParameters params = ssl.getSSLParameters();
                params.setEndpointIdentificationAlgorithm("HTTPS");
                ssl.setSSLParameters(params);
            }
            ssl.startHandshake();
            return ssl;
        } catch (IOException e) {
            IoUtils.closeQuietly(plain, "upstream socket");
            throw e;
        }
    }

    public HttpClient client() {
        return client;
    }

    public String getName() {
        return name;
    }

    public boolean isSecure() {
        return secure;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    /**
     * @return number of permits currently held
     */
    public int inUse() {
        return maxConnections - permits.availablePermits();
    }

    @Override
    public void close() {
        registry.remove(inUseGauge);
        clientExecutor.shutdownNow();
        log.debug("Upstream pool '{}' closed", name);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * A held connection slot. Closing it more than once has no further effect.
     */
    public final class Permit implements AutoCloseable {
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit() {
        }

        public UpstreamPool pool() {
            return UpstreamPool.this;
        }

        public boolean isReleased() {
            return released.get();
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                permits.release();
            }
        }
    }
}
