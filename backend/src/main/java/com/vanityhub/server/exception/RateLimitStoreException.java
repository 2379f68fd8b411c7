package com.vanityhub.server.exception;

/**
 * Thrown by a rate-limit store when a counter cannot be read or updated.
 * Callers decide between admitting and rejecting the request.
 */
public class RateLimitStoreException extends RuntimeException {

    public RateLimitStoreException(String message) {
        super(message);
    }

    public RateLimitStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
