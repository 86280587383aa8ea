package com.guildsentinel.core.audit;

/**
 * Raised when an audit entry cannot be made durable.
 */
public class AuditWriteException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AuditWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
