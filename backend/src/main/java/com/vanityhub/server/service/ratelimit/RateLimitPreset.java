package com.vanityhub.server.service.ratelimit;

import java.time.Duration;

/**
 * Named limits that endpoint policies can refer to.
 */
public enum RateLimitPreset {

    STRICT(Duration.ofMinutes(15), 10),
    MODERATE(Duration.ofMinutes(15), 50),
    LENIENT(Duration.ofMinutes(15), 100),
    LOGIN(Duration.ofMinutes(15), 5),
    REGISTRATION(Duration.ofHours(1), 3),
    UPLOAD(Duration.ofHours(1), 10);

    private final RateLimitRule rule;

    RateLimitPreset(Duration window, int maxRequests) {
        this.rule = new RateLimitRule(window.toMillis(), maxRequests);
    }

    public RateLimitRule rule() {
        return rule;
    }
}
