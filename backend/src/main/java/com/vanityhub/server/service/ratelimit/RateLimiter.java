package com.vanityhub.server.service.ratelimit;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.vanityhub.server.service.SecurityMetricsService;

/**
 * Fixed-window rate limiter.
 *
 * <p>The store increments the counter for a key atomically, resetting the
 * window when it has expired. The request is admitted iff the resulting
 * count is at most {@code maxRequests}, so the request that pushes the count
 * over the limit is itself rejected.</p>
 *
 * <p>{@link #check} never throws. When the store fails the request is
 * admitted or rejected according to {@code vanityhub.ratelimit.fail-open}.</p>
 */
@Service
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final RateLimitStore store;
    private final SecurityMetricsService metrics;
    private final Clock clock;
    private final boolean enabled;
    private final boolean failOpen;

    public RateLimiter(RateLimitStore store,
                       SecurityMetricsService metrics,
                       Clock clock,
                       @Value("${vanityhub.ratelimit.enabled:true}") boolean enabled,
                       @Value("${vanityhub.ratelimit.fail-open:true}") boolean failOpen) {
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
        this.enabled = enabled;
        this.failOpen = failOpen;
        log.info("[RateLimit] store={}, enabled={}, failOpen={}", store.name(), enabled, failOpen);
    }

    public RateLimitDecision check(RateLimitKey key, RateLimitRule rule) {
        return check(key, rule.windowMs(), rule.maxRequests());
    }

    public RateLimitDecision check(RateLimitKey key, long windowMs, int maxRequests) {
        long now = clock.millis();
        if (!enabled) {
            return RateLimitDecision.admit(maxRequests, maxRequests, now + windowMs);
        }

        RateLimitState state;
        try {
            state = store.increment(key.asString(), windowMs, now);
        } catch (RuntimeException e) {
            metrics.recordRateLimitStoreFailure();
            if (failOpen) {
                log.warn("[RateLimit] Store '{}' failed for {}, admitting (fail-open): {}",
                        store.name(), key.asString(), e.getMessage());
                return RateLimitDecision.admit(maxRequests, maxRequests, now + windowMs);
            }
            log.warn("[RateLimit] Store '{}' failed for {}, rejecting (fail-closed): {}",
                    store.name(), key.asString(), e.getMessage());
            return RateLimitDecision.reject(maxRequests, now + windowMs, ceilSeconds(windowMs));
        }

        long resetAt = state.resetAt(windowMs);
        if (state.count() <= maxRequests) {
            int remaining = (int) Math.max(0, maxRequests - state.count());
            return RateLimitDecision.admit(maxRequests, remaining, resetAt);
        }

        long retryAfter = ceilSeconds(resetAt - now);
        log.debug("[RateLimit] {} over limit ({} > {}), retry in {}s",
                key.asString(), state.count(), maxRequests, retryAfter);
        return RateLimitDecision.reject(maxRequests, resetAt, retryAfter);
    }

    private static long ceilSeconds(long millis) {
        return (millis + 999) / 1000;
    }
}
