package com.vanityhub.server.service.ratelimit;

/**
 * Counter window after an increment. {@code windowStart} is epoch millis.
 */
public record RateLimitState(long windowStart, long count) {

    public long resetAt(long windowMs) {
        return windowStart + windowMs;
    }
}
