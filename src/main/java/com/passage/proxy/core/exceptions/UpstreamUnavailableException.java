package com.passage.proxy.core.exceptions;

/**
 * Thrown when the origin server cannot be reached or does not answer in time
 * (DNS failure, refused connection, timeout, protocol error, exhausted pool).
 * Reported to the client as 502 Bad Gateway.
 */
public class UpstreamUnavailableException extends ProxyException {
    /**
     * Constructs a new UpstreamUnavailableException with the specified detail message.
     * 
     * @param message the detail message.
     */
    public UpstreamUnavailableException(String message) {
        super(message);
    }

    /**
     * Constructs a new UpstreamUnavailableException with the specified detail message and cause.
     * 
     * @param message the detail message.
     * @param cause   the cause of the exception.
     */
    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
