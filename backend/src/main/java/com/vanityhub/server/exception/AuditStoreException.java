package com.vanityhub.server.exception;

/**
 * Thrown when an audit entry cannot be persisted or audit history cannot be read.
 */
public class AuditStoreException extends RuntimeException {

    public AuditStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
