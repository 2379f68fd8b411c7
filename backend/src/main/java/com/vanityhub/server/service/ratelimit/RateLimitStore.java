package com.vanityhub.server.service.ratelimit;

import com.vanityhub.server.exception.RateLimitStoreException;

/**
 * Backing storage for fixed-window counters.
 *
 * <p>{@link #increment} must be atomic per key: start a new window when none
 * exists or the current one has expired ({@code now >= windowStart + windowMs}),
 * then add one to the count and return the resulting state.</p>
 */
public interface RateLimitStore {

    RateLimitState increment(String key, long windowMs, long now) throws RateLimitStoreException;

    /** Short name for logs and metrics. */
    String name();
}
