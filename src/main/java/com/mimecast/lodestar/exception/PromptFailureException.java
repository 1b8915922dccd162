package com.mimecast.lodestar.exception;

/**
 * Transport failure or unusable response from the account domain itself.
 */
public class PromptFailureException extends ClientDiscoveryException {

    /**
     * Constructs a new PromptFailureException.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public PromptFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public Failure getFailure() {
        return Failure.PROMPT;
    }
}
