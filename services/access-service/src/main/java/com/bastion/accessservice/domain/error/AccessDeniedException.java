package com.bastion.accessservice.domain.error;

/** Caller lacks the permission required for the operation. */
public class AccessDeniedException extends AccessException {

    public AccessDeniedException(String messageId, String message) {
        super(AccessErrorCode.PERMISSION_DENIED, messageId, message, null);
    }

    public AccessDeniedException(String messageId, String message, Throwable cause) {
        super(AccessErrorCode.PERMISSION_DENIED, messageId, message, cause);
    }
}
