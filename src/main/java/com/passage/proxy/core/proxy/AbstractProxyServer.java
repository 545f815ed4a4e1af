package com.passage.proxy.core.proxy;

import com.passage.proxy.config.ServerConfig;
import com.passage.proxy.core.services.AccessLogService;
import com.passage.proxy.core.utils.IoUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for socket servers: lifecycle, accept loop, connection limit and
 * graceful shutdown. Each accepted connection is handled by one task on a
 * cached thread pool.
 */
public abstract class AbstractProxyServer implements ProxyServer {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    /** Configuration for this server instance. */
    protected final ServerConfig config;

    /** Service for per-request logging. */
    protected final AccessLogService accessLog;

    /** Micrometer registry for metrics. */
    protected final MeterRegistry registry;

    /** Executor for connection handlers and tunnel copy tasks. */
    protected final ExecutorService executor;

    /** Semaphore to enforce the maximum number of concurrent connections. */
    protected final Semaphore connectionSemaphore;

    /** Set of active client sockets for shutdown. */
    protected final Set<Socket> activeSockets = ConcurrentHashMap.newKeySet();

    /** Client sockets waiting for their next request; closed first on shutdown. */
    protected final Set<Socket> idleSockets = ConcurrentHashMap.newKeySet();

    /** The main server socket listening for incoming connections. */
    protected volatile ServerSocket serverSocket;

    private final Counter totalConnections;
    private final Counter connectionErrors;
    private final Meter activeGauge;

    /** Released once the bind attempt has completed, successfully or not. */
    private final CountDownLatch bindLatch = new CountDownLatch(1);
    private volatile boolean bindSuccess = false;
    private volatile boolean running = false;

    /**
     * @param config    The server configuration.
     * @param accessLog The access log.
     * @param registry  The Micrometer meter registry.
     */
    protected AbstractProxyServer(ServerConfig config, AccessLogService accessLog, MeterRegistry registry) {
        this.config = config;
        this.accessLog = accessLog;
        this.registry = registry;
        this.executor = Executors.newCachedThreadPool(namedDaemonThreads(getProxyName().toLowerCase() + "-worker"));
        this.connectionSemaphore = new Semaphore(config.getMaxConnections());

        this.totalConnections = Counter.builder("proxy.connections.total")
                .description("Total number of accepted connections")
                .register(registry);

        this.connectionErrors = Counter.builder("proxy.connections.errors")
                .description("Total number of connection errors")
                .register(registry);

        this.activeGauge = Gauge.builder("proxy.connections.active", activeSockets, Set::size)
                .description("Current number of active connections")
                .register(registry);
    }

    /**
     * Binds to the configured address and enters the accept loop.
     */
    @Override
    public void start() {
        try {
            serverSocket = new ServerSocket();
            serverSocket.setReuseAddress(true);
            InetSocketAddress bindAddr = config.getBindAddress() != null
                    ? new InetSocketAddress(config.getBindAddress(), config.getPort())
                    : new InetSocketAddress(config.getPort());
            serverSocket.bind(bindAddr);
            running = true;
            bindSuccess = true;
            bindLatch.countDown();
            log.info("{} started on {}:{}", getProxyName(),
                    config.getBindAddress() != null ? config.getBindAddress() : "0.0.0.0",
                    serverSocket.getLocalPort());

            while (!serverSocket.isClosed()) {
                if (!acceptAndProcessNextClient()) {
                    break;
                }
            }
        } catch (IOException e) {
            bindLatch.countDown();
            connectionErrors.increment();
            log.error("{} server error on port {}: {}", getProxyName(), config.getPort(), e.getMessage(), e);
        }
    }

    private boolean acceptAndProcessNextClient() {
        try {
            Socket client = serverSocket.accept();
            processClient(client);
            return true;
        } catch (SocketException e) {
            if (serverSocket.isClosed()) {
                return false;
            }
            connectionErrors.increment();
            log.error("{} accept error on port {}: {}", getProxyName(), config.getPort(), e.getMessage());
            return true;
        } catch (IOException e) {
            connectionErrors.increment();
            log.error("{} I/O error during accept on port {}: {}", getProxyName(), config.getPort(),
                    e.getMessage());
            return true;
        }
    }

    /**
     * Waits for the server to finish binding to its port.
     *
     * @param timeout Maximum time to wait.
     * @param unit    Unit for the timeout.
     * @return {@code true} if the bind completed successfully within the timeout.
     */
    public boolean awaitBind(long timeout, TimeUnit unit) {
        try {
            return bindLatch.await(timeout, unit) && bindSuccess;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * @return the bound port, or the configured one before binding
     */
    public int getPort() {
        ServerSocket socket = serverSocket;
        return socket != null && socket.isBound() ? socket.getLocalPort() : config.getPort();
    }

    /**
     * @return {@code false} once {@link #stop()} has been called
     */
    public boolean isRunning() {
        return running;
    }

    private void processClient(Socket client) {
        String remoteAddr = client.getInetAddress().getHostAddress();

        totalConnections.increment();
        try {
            client.setTcpNoDelay(true);
            client.setSoTimeout(config.getTimeout());
        } catch (SocketException e) {
            log.debug("{} failed to configure client socket: {}", getProxyName(), e.getMessage());
        }

        if (connectionSemaphore.tryAcquire()) {
            activeSockets.add(client);
            try {
                executor.submit(() -> {
                    try {
                        handleClient(client);
                    } catch (Exception e) {
                        connectionErrors.increment();
                        log.error("{} unexpected error handling client {}: {}", getProxyName(), remoteAddr,
                                e.getMessage(), e);
                    } finally {
                        activeSockets.remove(client);
                        idleSockets.remove(client);
                        connectionSemaphore.release();
                        IoUtils.closeQuietly(client, "client socket");
                    }
                });
            } catch (RejectedExecutionException e) {
                activeSockets.remove(client);
                connectionSemaphore.release();
                IoUtils.closeQuietly(client, "rejected client socket");
            }
        } else {
            log.warn("{} connection limit reached ({})", getProxyName(), config.getMaxConnections());
            IoUtils.closeQuietly(client, "limit reached client socket");
        }
    }

    /**
     * Stops accepting, closes idle keep-alive connections, waits up to the
     * shutdown grace period for in-flight requests, then closes the rest.
     */
    @Override
    public void stop() {
        log.info("Stopping {} server on port {}...", getProxyName(), getPort());
        running = false;
        try {
            if (serverSocket != null) {
                serverSocket.close();
            }
        } catch (IOException e) {
            log.error("{} failed to close server socket: {}", getProxyName(), e.getMessage(), e);
        }

        for (Socket s : idleSockets) {
            IoUtils.closeQuietly(s, "idle client socket");
        }

        executor.shutdown();
        try {
            if (!executor.awaitTermination(config.getShutdownGracePeriod(), TimeUnit.MILLISECONDS)) {
                log.warn("{} connections still active after {} ms, closing them", getProxyName(),
                        config.getShutdownGracePeriod());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        for (Socket s : activeSockets) {
            IoUtils.closeQuietly(s);
        }
        activeSockets.clear();
        executor.shutdownNow();

        registry.remove(totalConnections);
        registry.remove(connectionErrors);
        registry.remove(activeGauge);
    }

    @Override
    @SuppressFBWarnings("EI_EXPOSE_REP")
    public ServerConfig getConfig() {
        return config;
    }

    protected void recordConnectionError() {
        connectionErrors.increment();
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Retrieves the server name used in logs and thread names.
     *
     * @return Descriptive name of the server.
     */
    protected abstract String getProxyName();

    /**
     * Handles an accepted client connection on a worker thread. The socket is
     * closed by the caller afterwards.
     *
     * @param client The accepted client socket.
     */
    protected abstract void handleClient(Socket client);
}
