package com.passage.proxy.core.exceptions;

/**
 * Thrown when a protocol-upgrade tunnel cannot be established or breaks.
 */
public class UpgradeTunnelException extends ProxyException {
    /**
     * Constructs a new UpgradeTunnelException with the specified detail message.
     * 
     * @param message the detail message.
     */
    public UpgradeTunnelException(String message) {
        super(message);
    }

    /**
     * Constructs a new UpgradeTunnelException with the specified detail message and cause.
     * 
     * @param message the detail message.
     * @param cause   the cause of the exception.
     */
    public UpgradeTunnelException(String message, Throwable cause) {
        super(message, cause);
    }
}
