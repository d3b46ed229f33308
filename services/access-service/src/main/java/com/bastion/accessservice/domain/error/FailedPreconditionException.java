package com.bastion.accessservice.domain.error;

/** The target exists but is not in a state that allows the operation. */
public class FailedPreconditionException extends AccessException {

    public FailedPreconditionException(String messageId, String message) {
        super(AccessErrorCode.FAILED_PRECONDITION, messageId, message, null);
    }

    public FailedPreconditionException(String messageId, String message, Throwable cause) {
        super(AccessErrorCode.FAILED_PRECONDITION, messageId, message, cause);
    }
}
