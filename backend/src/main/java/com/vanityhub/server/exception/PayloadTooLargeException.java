package com.vanityhub.server.exception;

/**
 * Thrown when a request body exceeds the configured buffering limit.
 */
public class PayloadTooLargeException extends RuntimeException {

    private final long limit;

    public PayloadTooLargeException(long limit) {
        super("Request body exceeds " + limit + " bytes");
        this.limit = limit;
    }

    public long getLimit() {
        return limit;
    }
}
