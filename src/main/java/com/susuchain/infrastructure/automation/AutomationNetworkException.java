package com.susuchain.infrastructure.automation;

/**
 * Failure reported by (or while reaching) the automation network.
 *
 * The code is derived from the response status, never from message wording.
 */
public class AutomationNetworkException extends RuntimeException {

    private final ErrorCode errorCode;

    public AutomationNetworkException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AutomationNetworkException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public enum ErrorCode {
        /**
         * An identical task is already registered.
         */
        DUPLICATE_TASK,
        TASK_NOT_FOUND,
        /**
         * The network refused the request (bad arguments, insufficient balance, auth).
         */
        REJECTED,
        /**
         * Network unreachable, timed out, or failed server-side. The request may or may not have been applied.
         */
        UNAVAILABLE
    }
}
