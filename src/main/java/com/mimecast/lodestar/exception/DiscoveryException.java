package com.mimecast.lodestar.exception;

/**
 * Base exception for discovery failures.
 */
public class DiscoveryException extends Exception {

    /**
     * Constructs a new DiscoveryException.
     *
     * @param message Error message.
     */
    public DiscoveryException(String message) {
        super(message);
    }

    /**
     * Constructs a new DiscoveryException with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
