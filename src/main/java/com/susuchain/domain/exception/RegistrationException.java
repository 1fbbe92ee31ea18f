package com.susuchain.domain.exception;

/**
 * Exception thrown when creating or cancelling a duty fails.
 *
 * When {@link #isOutcomeUnknown()} is true the call timed out or was interrupted
 * after it may have reached the automation network. The duty may or may not
 * exist; callers must re-query the registry instead of trusting this failure.
 */
public class RegistrationException extends RuntimeException {

    private final String target;
    private final boolean outcomeUnknown;

    public RegistrationException(String message, String target, Throwable cause) {
        this(message, target, false, cause);
    }

    public RegistrationException(String message, String target, boolean outcomeUnknown, Throwable cause) {
        super(message, cause);
        this.target = target;
        this.outcomeUnknown = outcomeUnknown;
    }

    public String getTarget() {
        return target;
    }

    public boolean isOutcomeUnknown() {
        return outcomeUnknown;
    }
}
