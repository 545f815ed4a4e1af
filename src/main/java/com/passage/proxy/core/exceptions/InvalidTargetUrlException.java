package com.passage.proxy.core.exceptions;

/**
 * Thrown when the path after the proxy prefix is not an absolute http or https URL.
 * Reported to the client as 400 Bad Request; the request is never forwarded.
 */
public class InvalidTargetUrlException extends ProxyException {
    /**
     * Constructs a new InvalidTargetUrlException with the specified detail message.
     * 
     * @param message the detail message.
     */
    public InvalidTargetUrlException(String message) {
        super(message);
    }

    /**
     * Constructs a new InvalidTargetUrlException with the specified detail message and cause.
     * 
     * @param message the detail message.
     * @param cause   the cause of the exception.
     */
    public InvalidTargetUrlException(String message, Throwable cause) {
        super(message, cause);
    }
}
