package com.bastion.accessservice.domain.error;

/**
 * Base of the typed error taxonomy.
 * <p>
 * {@code messageId} is a stable identifier of the failure site (e.g. {@code COMMAND-5m9Gq}) that
 * clients and support can search for; the message itself is human-readable and never reveals
 * whether a resource the caller may not see exists.
 */
public abstract class AccessException extends RuntimeException {

    private final AccessErrorCode code;
    private final String messageId;

    protected AccessException(AccessErrorCode code, String messageId, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.messageId = messageId;
    }

    public AccessErrorCode code() {
        return code;
    }

    public String messageId() {
        return messageId;
    }
}
