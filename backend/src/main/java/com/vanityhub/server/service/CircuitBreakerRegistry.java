package com.vanityhub.server.service;

import java.time.Clock;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Named circuit breakers for external stores (Redis counters, alert webhook).
 *
 * <pre>
 *   CLOSED ──(failures ≥ threshold)──→ OPEN
 *   OPEN   ──(cooldown elapsed)──────→ HALF_OPEN
 *   HALF_OPEN ──(trial succeeds)─────→ CLOSED
 *   HALF_OPEN ──(trial fails)────────→ OPEN
 * </pre>
 */
@Service
public class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Clock clock;

    public CircuitBreakerRegistry(Clock clock) {
        this.clock = clock;
    }

    /** Get or create a breaker. Parameters apply only on creation. */
    public CircuitBreaker get(String name, int failureThreshold, long cooldownMs) {
        return breakers.computeIfAbsent(name, n -> new CircuitBreaker(n, failureThreshold, cooldownMs, clock));
    }

    public Set<String> names() {
        return Set.copyOf(breakers.keySet());
    }

    // ===================== CIRCUIT BREAKER =====================

    public static class CircuitBreaker {

        public enum State { CLOSED, OPEN, HALF_OPEN }

        private final String name;
        private final int failureThreshold;
        private final long cooldownMs;
        private final Clock clock;

        private volatile State state = State.CLOSED;
        private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
        private volatile long openedAtMs = 0;

        private final AtomicLong totalRejections = new AtomicLong();
        private final AtomicLong totalTrips = new AtomicLong();

        CircuitBreaker(String name, int failureThreshold, long cooldownMs, Clock clock) {
            this.name = name;
            this.failureThreshold = failureThreshold;
            this.cooldownMs = cooldownMs;
            this.clock = clock;
            log.info("[CB:{}] Created, threshold={}, cooldown={}ms", name, failureThreshold, cooldownMs);
        }

        public boolean isCallPermitted() {
            switch (state) {
                case CLOSED -> { return true; }
                case OPEN -> {
                    if (clock.millis() - openedAtMs >= cooldownMs) {
                        state = State.HALF_OPEN;
                        log.info("[CB:{}] OPEN → HALF_OPEN (cooldown elapsed)", name);
                        return true;
                    }
                    totalRejections.incrementAndGet();
                    return false;
                }
                case HALF_OPEN -> { return true; }
            }
            return false;
        }

        public void recordSuccess() {
            consecutiveFailures.set(0);
            if (state == State.HALF_OPEN) {
                state = State.CLOSED;
                log.info("[CB:{}] HALF_OPEN → CLOSED (trial call succeeded)", name);
            }
        }

        public void recordFailure() {
            int failures = consecutiveFailures.incrementAndGet();
            if (state == State.HALF_OPEN || (state == State.CLOSED && failures >= failureThreshold)) {
                state = State.OPEN;
                openedAtMs = clock.millis();
                totalTrips.incrementAndGet();
                log.warn("[CB:{}] → OPEN (tripped after {} consecutive failures)", name, failures);
            }
        }

        public String getName()            { return name; }
        public State  getState()           { return state; }
        public long   getTotalRejections() { return totalRejections.get(); }
        public long   getTotalTrips()      { return totalTrips.get(); }
    }
}
