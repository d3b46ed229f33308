package com.bastion.accessservice.domain.error;

/** Unexpected failure inside the service. */
public class InternalException extends AccessException {

    public InternalException(String messageId, String message) {
        super(AccessErrorCode.INTERNAL, messageId, message, null);
    }

    public InternalException(String messageId, String message, Throwable cause) {
        super(AccessErrorCode.INTERNAL, messageId, message, cause);
    }
}
