package com.passage.proxy.config;

/**
 * Configuration for the outbound side: connection pools, timeouts and TLS trust.
 */
public class UpstreamConfig {
    /** Maximum concurrent connections held by each pool (plain and TLS). */
    private int maxConnectionsPerPool = 50;

    /** Time to wait for response headers or a free pool slot, in milliseconds. */
    private int timeout = 60000;

    /** TCP connect timeout in milliseconds. */
    private int connectTimeout = 10000;

    /**
     * Accept any upstream certificate chain and skip hostname verification.
     * Weakens the security of every proxied TLS session; see DESIGN.md.
     */
    private boolean trustAllCertificates = true;

    /** Remove explicit ports from target URLs so origins are reached on default ports. */
    private boolean stripExplicitPorts = true;

    public int getMaxConnectionsPerPool() {
        return maxConnectionsPerPool;
    }

    public void setMaxConnectionsPerPool(int maxConnectionsPerPool) {
        this.maxConnectionsPerPool = maxConnectionsPerPool;
    }

    public int getTimeout() {
        return timeout;
    }

    public void setTimeout(int timeout) {
        this.timeout = timeout;
    }

    public int getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(int connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public boolean isTrustAllCertificates() {
        return trustAllCertificates;
    }

    public void setTrustAllCertificates(boolean trustAllCertificates) {
        this.trustAllCertificates = trustAllCertificates;
    }

    public boolean isStripExplicitPorts() {
        return stripExplicitPorts;
    }

    public void setStripExplicitPorts(boolean stripExplicitPorts) {
        this.stripExplicitPorts = stripExplicitPorts;
    }
}
