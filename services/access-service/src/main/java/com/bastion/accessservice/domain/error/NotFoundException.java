package com.bastion.accessservice.domain.error;

/** The target does not exist, was removed, or belongs to another organization. */
public class NotFoundException extends AccessException {

    public NotFoundException(String messageId, String message) {
        super(AccessErrorCode.NOT_FOUND, messageId, message, null);
    }

    public NotFoundException(String messageId, String message, Throwable cause) {
        super(AccessErrorCode.NOT_FOUND, messageId, message, cause);
    }
}
