package com.passage.proxy.core.exceptions;

/**
 * Thrown when a response field cannot be rewritten, typically a malformed URL
 * reference. Rewrite stages catch it and leave the affected field unchanged.
 */
public class RewriteException extends ProxyException {
    /**
     * Constructs a new RewriteException with the specified detail message.
     * 
     * @param message the detail message.
     */
    public RewriteException(String message) {
        super(message);
    }

    /**
     * Constructs a new RewriteException with the specified detail message and cause.
     * 
     * @param message the detail message.
     * @param cause   the cause of the exception.
     */
    public RewriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
