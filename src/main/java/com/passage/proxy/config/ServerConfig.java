package com.passage.proxy.config;

import java.util.Objects;

/**
 * Configuration for the inbound listener and the proxy path namespace.
 */
public class ServerConfig {
    /** Port to listen on. */
    private int port = 8080;

    /** Local IP address to bind to. Null means all interfaces. */
    private String bindAddress;

    /** Path prefix that precedes every embedded target URL. */
    private String proxyPrefix = "/proxy/";

    /** Maximum concurrent client connections. */
    private int maxConnections = 1000;

    /** Client socket read timeout in milliseconds. Default is 60s. */
    private int timeout = 60000;

    /** Whether client connections are kept open between requests. */
    private boolean keepAlive = true;

    /** How long shutdown waits for in-flight connections, in milliseconds. */
    private int shutdownGracePeriod = 10000;

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getBindAddress() {
        return bindAddress;
    }

    public void setBindAddress(String bindAddress) {
        this.bindAddress = bindAddress;
    }

    public String getProxyPrefix() {
        return proxyPrefix;
    }

    public void setProxyPrefix(String proxyPrefix) {
        this.proxyPrefix = proxyPrefix;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
    }

    public int getTimeout() {
        return timeout;
    }

    public void setTimeout(int timeout) {
        this.timeout = timeout;
    }

    public boolean isKeepAlive() {
        return keepAlive;
    }

    public void setKeepAlive(boolean keepAlive) {
        this.keepAlive = keepAlive;
    }

    public int getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public void setShutdownGracePeriod(int shutdownGracePeriod) {
        this.shutdownGracePeriod = shutdownGracePeriod;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ServerConfig that = (ServerConfig) o;
        return port == that.port &&
               maxConnections == that.maxConnections &&
               timeout == that.timeout &&
               keepAlive == that.keepAlive &&
               shutdownGracePeriod == that.shutdownGracePeriod &&
               Objects.equals(bindAddress, that.bindAddress) &&
               Objects.equals(proxyPrefix, that.proxyPrefix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(port, bindAddress, proxyPrefix, maxConnections, timeout, keepAlive,
                shutdownGracePeriod);
    }
}
