package com.vanityhub.server.exception;

/**
 * Thrown when an audit log query carries an unusable filter.
 */
public class InvalidAuditQueryException extends RuntimeException {
    private final String parameter;

    public InvalidAuditQueryException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
