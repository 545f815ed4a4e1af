package com.passage.proxy.config;

import com.passage.proxy.core.exceptions.ConfigException;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Root configuration object for the Passage Proxy.
 * Maps to the top-level structure of application.yml.
 */
public class PassageProperties {
    /**
     * Inbound listener configuration.
     */
    private ServerConfig server = new ServerConfig();

    /**
     * Outbound connection pools configuration.
     */
    private UpstreamConfig upstream = new UpstreamConfig();

    /**
     * Request logging configuration.
     */
    private LoggingConfig logging = new LoggingConfig();

    /**
     * Administration and metrics configuration.
     */
    private AdminConfig admin = new AdminConfig();

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public ServerConfig getServer() {
        return server;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setServer(ServerConfig server) {
        this.server = server;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public UpstreamConfig getUpstream() {
        return upstream;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setUpstream(UpstreamConfig upstream) {
        this.upstream = upstream;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public LoggingConfig getLogging() {
        return logging;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setLogging(LoggingConfig logging) {
        this.logging = logging;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public AdminConfig getAdmin() {
        return admin;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setAdmin(AdminConfig admin) {
        this.admin = admin;
    }

    /**
     * Replaces sections left out of the YAML file (or written as empty keys)
     * by their defaults.
     */
    public void fillDefaults() {
        if (server == null) {
            server = new ServerConfig();
        }
        if (upstream == null) {
            upstream = new UpstreamConfig();
        }
        if (logging == null) {
            logging = new LoggingConfig();
        }
        if (admin == null) {
            admin = new AdminConfig();
        }
    }

    /**
     * Checks the loaded values for consistency, filling in missing sections first.
     *
     * @throws ConfigException if a value is out of range.
     */
    public void validate() {
        fillDefaults();

        checkPort("server.port", server.getPort());
        if (admin.isEnabled()) {
            checkPort("admin.port", admin.getPort());
        }

        String prefix = server.getProxyPrefix();
        if (prefix == null || prefix.length() < 3 || !prefix.startsWith("/") || !prefix.endsWith("/")) {
            throw new ConfigException("server.proxyPrefix must look like '/name/', got: " + prefix);
        }
        if (server.getMaxConnections() <= 0) {
            throw new ConfigException("server.maxConnections must be positive");
        }
        if (server.getTimeout() < 0 || server.getShutdownGracePeriod() < 0) {
            throw new ConfigException("server.timeout and server.shutdownGracePeriod must not be negative");
        }
        if (upstream.getMaxConnectionsPerPool() <= 0) {
            throw new ConfigException("upstream.maxConnectionsPerPool must be positive");
        }
        if (upstream.getTimeout() <= 0 || upstream.getConnectTimeout() <= 0) {
            throw new ConfigException("upstream.timeout and upstream.connectTimeout must be positive");
        }
    }

    private static void checkPort(String name, int port) {
        if (port < 0 || port > 65535) {
            throw new ConfigException(name + " out of range: " + port);
        }
    }
}
