package com.vanityhub.server.service.ratelimit;

/** A window length and the number of requests admitted within it. */
public record RateLimitRule(long windowMs, int maxRequests) {

    public RateLimitRule {
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be positive");
        }
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
    }
}
