package com.bastion.accessservice.domain.error;

/** The request itself is malformed. */
public class InvalidArgumentException extends AccessException {

    public InvalidArgumentException(String messageId, String message) {
        super(AccessErrorCode.INVALID_ARGUMENT, messageId, message, null);
    }

    public InvalidArgumentException(String messageId, String message, Throwable cause) {
        super(AccessErrorCode.INVALID_ARGUMENT, messageId, message, cause);
    }
}
