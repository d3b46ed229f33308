package com.bastion.accessservice.domain.error;

/** The aggregate moved on since it was read. Retry after re-reading. */
public class ConflictException extends AccessException {

    public ConflictException(String messageId, String message) {
        super(AccessErrorCode.CONFLICT, messageId, message, null);
    }

    public ConflictException(String messageId, String message, Throwable cause) {
        super(AccessErrorCode.CONFLICT, messageId, message, cause);
    }
}
