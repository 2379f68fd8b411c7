package com.vanityhub.server.service.ratelimit;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Single-instance counter store.
 *
 * Each key's read-reset-increment runs inside {@link ConcurrentHashMap#compute},
 * which locks the bin for that key only, so concurrent requests on the same
 * key serialize while unrelated keys proceed in parallel.
 *
 * Windows that expired more than {@code graceMs} ago are evicted by a
 * scheduled sweep to keep memory bounded by active clients.
 */
public class InMemoryRateLimitStore implements RateLimitStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRateLimitStore.class);

    private record Window(long start, long windowMs, long count) {}

    private final ConcurrentHashMap<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;
    private final long graceMs;

    public InMemoryRateLimitStore(Clock clock, long graceMs) {
        this.clock = clock;
        this.graceMs = graceMs;
    }

    @Override
    public RateLimitState increment(String key, long windowMs, long now) {
        Window updated = windows.compute(key, (k, w) -> {
            if (w == null || now >= w.start() + windowMs) {
                return new Window(now, windowMs, 1);
            }
            return new Window(w.start(), windowMs, w.count() + 1);
        });
        return new RateLimitState(updated.start(), updated.count());
    }

    @Override
    public String name() {
        return "memory";
    }

    @Scheduled(fixedDelayString = "${vanityhub.ratelimit.eviction-interval-ms:60000}")
    public void evictExpired() {
        long now = clock.millis();
        int before = windows.size();
        windows.entrySet().removeIf(e -> {
            Window w = e.getValue();
            return now >= w.start() + w.windowMs() + graceMs;
        });
        int evicted = before - windows.size();
        if (evicted > 0) {
            log.debug("[RateLimit] Evicted {} expired windows ({} active)", evicted, windows.size());
        }
    }

    /** Number of tracked windows. */
    public int size() {
        return windows.size();
    }
}
