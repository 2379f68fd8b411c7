package com.vanityhub.server.service.ratelimit;

/**
 * Counter identity: who is calling and which endpoint they are calling.
 * The client identity is the principal id for authenticated callers and
 * the client IP otherwise. The endpoint is the method plus the matched
 * policy pattern (for example {@code GET:/api/reports/**}), so concrete
 * paths under one pattern share a counter.
 */
public record RateLimitKey(String clientIdentity, String endpointPath) {

    public RateLimitKey {
        clientIdentity = clientIdentity == null || clientIdentity.isBlank() ? "unknown" : clientIdentity;
        endpointPath = endpointPath == null ? "" : endpointPath;
    }

    /** Flat form used as the store key. */
    public String asString() {
        return clientIdentity + ":" + endpointPath;
    }
}
