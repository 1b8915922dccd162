package com.mimecast.lodestar.exception;

/**
 * Client discovery failure.
 * <p>The two subclasses map to the FAIL_PROMPT and FAIL_ERROR outcomes of client well-known discovery.
 *
 * @see PromptFailureException
 * @see HardFailureException
 */
public abstract class ClientDiscoveryException extends DiscoveryException {

    /**
     * Failure tier.
     */
    public enum Failure {
        /**
         * The account domain could not be queried, the user may be prompted or the lookup retried.
         */
        PROMPT,

        /**
         * Delegation content is broken, the configuration is unusable as published.
         */
        ERROR
    }

    /**
     * Constructs a new ClientDiscoveryException with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    protected ClientDiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Gets failure tier.
     *
     * @return Failure instance.
     */
    public abstract Failure getFailure();
}
