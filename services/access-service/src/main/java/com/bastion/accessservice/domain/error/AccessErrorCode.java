package com.bastion.accessservice.domain.error;

/**
 * Error categories every command and query can fail with. Each maps to one transport status.
 */
public enum AccessErrorCode {
    PERMISSION_DENIED(false),
    INVALID_ARGUMENT(false),
    NOT_FOUND(false),
    FAILED_PRECONDITION(false),
    CONFLICT(true),
    DEADLINE_EXCEEDED(true),
    INTERNAL(false);

    private final boolean retryable;

    AccessErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    /** Whether the caller may retry the same request unchanged (after re-reading, for CONFLICT). */
    public boolean retryable() {
        return retryable;
    }

    /** Errors caused by the request rather than by the service. */
    public boolean clientError() {
        return this != INTERNAL;
    }
}
