package com.passage.proxy.core.services;

import com.passage.proxy.config.AdminConfig;
import com.passage.proxy.config.PassageProperties;
import com.sun.net.httpserver.HttpServer;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the meter registry and the admin HTTP server exposing {@code /health}
 * and {@code /metrics} (Prometheus text format).
 */
public class MetricsService {
    private static final Logger log = LoggerFactory.getLogger(MetricsService.class);
    private final PrometheusMeterRegistry registry;
    private final AdminConfig config;
    private HttpServer adminServer;
    private ExecutorService adminExecutor;

    public MetricsService(PassageProperties properties) {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        this.config = properties.getAdmin();
    }

    /**
     * Starts the admin server if enabled. A bind failure is logged and the
     * proxy keeps running without it.
     */
    public void start() {
        if (!config.isEnabled()) {
            return;
        }

        try {
            this.adminServer = HttpServer.create(new InetSocketAddress(config.getBindAddress(), config.getPort()), 0);

            adminServer.createContext("/health", exchange -> {
                byte[] response = "OK".getBytes(StandardCharsets.UTF_8);
                exchange.sendResponseHeaders(200, response.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(response);
                }
            });

            adminServer.createContext("/metrics", exchange -> {
                byte[] bytes = registry.scrape().getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
                exchange.sendResponseHeaders(200, bytes.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(bytes);
                }
            });

            adminExecutor = Executors.newFixedThreadPool(2, r -> {
                Thread t = new Thread(r, "admin-http");
                t.setDaemon(true);
                return t;
            });
            adminServer.setExecutor(adminExecutor);
            adminServer.start();
            log.info("Admin server started on {}:{} (/health, /metrics)", config.getBindAddress(),
                    adminServer.getAddress().getPort());
        } catch (IOException e) {
            log.error("Failed to start admin server: {}", e.getMessage());
            adminServer = null;
        }
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * @return the bound admin port, or -1 if the admin server is not running
     */
    public int getAdminPort() {
        return adminServer != null ? adminServer.getAddress().getPort() : -1;
    }

    public void shutdown() {
        if (adminServer != null) {
            log.info("Stopping admin server...");
            adminServer.stop(0);
            adminServer = null;
        }
        if (adminExecutor != null) {
            adminExecutor.shutdownNow();
            adminExecutor = null;
        }
    }
}
