package com.passage.proxy.core.proxy;

import com.passage.proxy.config.ServerConfig;

/**
 * Interface representing a proxy server instance.
 */
public interface ProxyServer {
    /**
     * Binds the listening socket and runs the accept loop on the calling
     * thread until {@link #stop()} is called.
     */
    void start();

    /**
     * Stops accepting, lets in-flight requests finish within the grace period,
     * then closes everything that is still open.
     */
    void stop();

    /**
     * Retrieves the server configuration.
     * @return The configuration used by this server.
     */
    ServerConfig getConfig();
}
