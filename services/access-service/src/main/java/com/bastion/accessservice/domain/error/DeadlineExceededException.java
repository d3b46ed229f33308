package com.bastion.accessservice.domain.error;

/** The caller's deadline passed before the change was committed. */
public class DeadlineExceededException extends AccessException {

    public DeadlineExceededException(String messageId, String message) {
        super(AccessErrorCode.DEADLINE_EXCEEDED, messageId, message, null);
    }

    public DeadlineExceededException(String messageId, String message, Throwable cause) {
        super(AccessErrorCode.DEADLINE_EXCEEDED, messageId, message, cause);
    }
}
