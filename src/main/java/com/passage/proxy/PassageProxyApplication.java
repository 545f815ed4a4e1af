package com.passage.proxy;

import com.passage.proxy.config.EnvironmentOverrides;
import com.passage.proxy.config.PassageProperties;
import com.passage.proxy.core.exceptions.ConfigException;
import com.passage.proxy.core.exceptions.ProxyException;
import com.passage.proxy.core.pool.UpstreamPools;
import com.passage.proxy.core.proxy.WebProxyServer;
import com.passage.proxy.core.services.AccessLogService;
import com.passage.proxy.core.services.MetricsService;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main entry point for Passage Proxy.
 * Handles command-line arguments, configuration loading, and application
 * lifecycle.
 */
@Command(name = "passage-proxy", mixinStandardHelpOptions = true, version = "1.0.0",
        description = "Web proxy that serves arbitrary sites under a path prefix.")
public class PassageProxyApplication implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PassageProxyApplication.class);

    private static final long BIND_TIMEOUT_SECONDS = 10;

    /**
     * Path to the YAML configuration file.
     */
    @Option(names = { "-c", "--config" }, description = "Path to config file (YAML)", defaultValue = "application.yml")
    private String configPath;

    /**
     * Listen port; overrides the configuration file and the PORT variable.
     */
    @Option(names = { "-p", "--port" }, description = "Listen port (overrides config and PORT)")
    private Integer port;

    private final Function<String, String> envLookup;

    private MetricsService metricsService;
    private UpstreamPools pools;
    private volatile WebProxyServer server;

    /** Latch to block the main thread until shutdown is triggered. */
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    private final AtomicBoolean running = new AtomicBoolean(true);

    /** Reference to the registered shutdown hook for cleanup. */
    private Thread shutdownHook;

    public PassageProxyApplication() {
        this(System::getenv);
    }

    PassageProxyApplication(Function<String, String> envLookup) {
        this.envLookup = envLookup;
    }

    /**
     * Main method to launch the application.
     *
     * @param args Command-line arguments.
     */
    public static void main(String[] args) {
        System.exit(new CommandLine(new PassageProxyApplication()).execute(args));
    }

    /**
     * Loads the configuration, starts the proxy and blocks until shutdown.
     *
     * @return Exit code (0 for success, 1 for failure).
     */
    @Override
    public Integer call() {
        try {
            log.info("Starting Passage Proxy...");

            PassageProperties props = loadConfig(configPath);
            props.fillDefaults();
            EnvironmentOverrides.apply(props, envLookup);
            if (port != null) {
                props.getServer().setPort(port);
            }
            props.validate();

            if (props.getUpstream().isTrustAllCertificates()) {
                log.warn("Upstream TLS certificate and hostname verification is DISABLED "
                        + "(upstream.trustAllCertificates=true)");
            }

            this.metricsService = new MetricsService(props);
            metricsService.start();
            this.pools = new UpstreamPools(props.getUpstream(), metricsService.getRegistry());
            this.server = new WebProxyServer(props, pools, new AccessLogService(props.getLogging()),
                    metricsService.getRegistry());

            Thread acceptor = new Thread(server::start, "http-acceptor");
            acceptor.setDaemon(true);
            acceptor.start();
            if (!server.awaitBind(BIND_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                throw new ProxyException("Failed to bind port " + props.getServer().getPort());
            }
            log.info("Passage Proxy ready: {}<url> on port {}", props.getServer().getProxyPrefix(), server.getPort());

            if (System.getProperty("passage.no-shutdown-hook") == null) {
                this.shutdownHook = new Thread(this::stop, "ShutdownHook");
                Runtime.getRuntime().addShutdownHook(shutdownHook);
            }

            shutdownLatch.await();
            return 0;
        } catch (ConfigException e) {
            log.error("Configuration Error: {}", e.getMessage());
            return 1;
        } catch (ProxyException e) {
            log.error("Fatal proxy error: {}", e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            log.warn("Application interrupted");
            Thread.currentThread().interrupt();
            return 0;
        } catch (Exception e) {
            log.error("Unexpected fatal error", e);
            return 1;
        } finally {
            stop();
        }
    }

    /**
     * Stops the proxy server, the upstream pools and the admin server.
     * Safe to call more than once and from the shutdown hook.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down Passage Proxy...");

            unregisterShutdownHook();

            if (server != null) {
                server.stop();
            }
            if (pools != null) {
                pools.close();
            }
            if (metricsService != null) {
                metricsService.shutdown();
            }
            shutdownLatch.countDown();
        }
    }

    /**
     * @return the running server, or {@code null} before startup
     */
    WebProxyServer getServer() {
        return server;
    }

    private void unregisterShutdownHook() {
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException ignored) {
                // This is expected if stop() is called from the hook itself
            }
        }
    }

    /**
     * Loads the configuration from the specified path or classpath.
     *
     * @param path Path to the configuration file.
     * @return Loaded properties; defaults for an empty document.
     * @throws ConfigException if configuration cannot be loaded.
     */
    PassageProperties loadConfig(String path) {
        Yaml yaml = new Yaml(new Constructor(PassageProperties.class, new LoaderOptions()));

        PassageProperties fromFile = tryLoadFromFile(yaml, path);
        if (fromFile != null) {
            return fromFile;
        }

        PassageProperties fromClasspath = tryLoadFromClasspath(yaml, path);
        if (fromClasspath != null) {
            return fromClasspath;
        }

        throw new ConfigException("Configuration file not found: " + path);
    }

    private PassageProperties tryLoadFromFile(Yaml yaml, String path) {
        File file = new File(path);
        if (file.exists()) {
            try (InputStream is = new FileInputStream(file)) {
                PassageProperties loaded = yaml.load(is);
                return loaded != null ? loaded : new PassageProperties();
            } catch (YAMLException e) {
                throw new ConfigException("Invalid YAML in " + path + ": " + e.getMessage());
            } catch (IOException e) {
                throw new ConfigException("Error reading config file: " + path, e);
            }
        }
        return null;
    }

    private PassageProperties tryLoadFromClasspath(Yaml yaml, String path) {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                PassageProperties loaded = yaml.load(is);
                return loaded != null ? loaded : new PassageProperties();
            }
        } catch (YAMLException e) {
            throw new ConfigException("Invalid YAML in classpath resource " + path + ": " + e.getMessage());
        } catch (IOException e) {
            log.debug("Classpath resource lookup failed for {}", path);
        }
        return null;
    }
}
