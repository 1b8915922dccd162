package com.mimecast.lodestar.exception;

/**
 * Delegation target is malformed or failed validation.
 */
public class HardFailureException extends ClientDiscoveryException {

    /**
     * What broke.
     */
    public enum Reason {
        /**
         * A base URL in the document is not a valid URL.
         */
        URL,

        /**
         * Validation request against the delegated target failed.
         */
        HTTP
    }

    private final Reason reason;

    /**
     * Constructs a new HardFailureException.
     *
     * @param reason  Reason instance.
     * @param message Error message.
     * @param cause   Underlying cause, may be null.
     */
    public HardFailureException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /**
     * Gets reason.
     *
     * @return Reason instance.
     */
    public Reason getReason() {
        return reason;
    }

    @Override
    public Failure getFailure() {
        return Failure.ERROR;
    }
}
