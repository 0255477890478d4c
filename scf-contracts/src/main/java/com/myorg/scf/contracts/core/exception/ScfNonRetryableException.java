package com.myorg.scf.contracts.core.exception;

/**
 * Failure that will not go away by calling again: a malformed sidecar response,
 * an etag conflict, a missing store. Callers should surface it, not retry it.
 */
public class ScfNonRetryableException extends RuntimeException {

    private final String reason;

    public ScfNonRetryableException(String message) {
        this("NON_RETRYABLE", message);
    }

    public ScfNonRetryableException(String reason, String message) {
        this(reason, message, null);
    }

    public ScfNonRetryableException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = (reason == null || reason.isBlank()) ? "NON_RETRYABLE" : reason;
    }

    public String getReason() {
        return reason;
    }
}
