package com.vanityhub.server.service.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.vanityhub.server.exception.RateLimitStoreException;
import com.vanityhub.server.service.SecurityMetricsService;
import com.vanityhub.server.support.MutableClock;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    private static final RateLimitKey KEY = new RateLimitKey("203.0.113.7", "POST:/api/auth/login");

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private SecurityMetricsService metrics;
    private RateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        registry = new SimpleMeterRegistry();
        metrics = new SecurityMetricsService(registry);
        limiter = new RateLimiter(new InMemoryRateLimitStore(clock, 60_000), metrics, clock, true, true);
    }

    // ===== Fixed window =====

    @Test
    void shouldAdmitUpToLimitThenReject() {
        RateLimitRule login = RateLimitPreset.LOGIN.rule();
        List<Integer> remaining = new ArrayList<>();

        for (int i = 0; i < 5; i++) {
            RateLimitDecision decision = limiter.check(KEY, login);
            assertTrue(decision.admitted(), "call " + (i + 1) + " should be admitted");
            assertEquals(5, decision.limit());
            remaining.add(decision.remaining());
        }
        RateLimitDecision sixth = limiter.check(KEY, login);

        assertEquals(List.of(4, 3, 2, 1, 0), remaining);
        assertFalse(sixth.admitted());
        assertEquals(0, sixth.remaining());
        assertEquals(900, sixth.retryAfterSeconds());
        assertEquals(clock.millis() + 900_000, sixth.resetAt());
    }

    @Test
    void shouldRoundRetryAfterUp() {
        limiter.check(KEY, 10_000, 1);
        clock.advanceMillis(2_500);

        RateLimitDecision rejected = limiter.check(KEY, 10_000, 1);

        assertFalse(rejected.admitted());
        assertEquals(8, rejected.retryAfterSeconds());
    }

    @Test
    void shouldStartFreshWindowAfterExpiry() {
        RateLimitRule login = RateLimitPreset.LOGIN.rule();
        for (int i = 0; i < 6; i++) {
            limiter.check(KEY, login);
        }

        clock.advance(Duration.ofMinutes(15));
        RateLimitDecision decision = limiter.check(KEY, login);

        assertTrue(decision.admitted());
        assertEquals(4, decision.remaining());
    }

    @Test
    void shouldCountKeysIndependently() {
        RateLimitKey otherPath = new RateLimitKey("203.0.113.7", "POST:/api/auth/register");
        limiter.check(KEY, 60_000, 1);

        assertFalse(limiter.check(KEY, 60_000, 1).admitted());
        assertTrue(limiter.check(otherPath, 60_000, 1).admitted());
    }

    // ===== Store failure =====

    @Test
    void shouldAdmitWhenStoreFailsAndFailOpen() {
        RateLimiter failOpen = new RateLimiter(failingStore(), metrics, clock, true, true);

        RateLimitDecision decision = failOpen.check(KEY, 60_000, 10);

        assertTrue(decision.admitted());
        assertEquals(10, decision.remaining());
        assertEquals(1.0, registry.counter("security.ratelimit.store_failures").count());
    }

    @Test
    void shouldRejectWhenStoreFailsAndFailClosed() {
        RateLimiter failClosed = new RateLimiter(failingStore(), metrics, clock, true, false);

        RateLimitDecision decision = failClosed.check(KEY, 60_000, 10);

        assertFalse(decision.admitted());
        assertEquals(60, decision.retryAfterSeconds());
        assertEquals(1.0, registry.counter("security.ratelimit.store_failures").count());
    }

    @Test
    void shouldAdmitEverythingWhenDisabled() {
        RateLimiter disabled = new RateLimiter(failingStore(), metrics, clock, false, false);

        for (int i = 0; i < 20; i++) {
            assertTrue(disabled.check(KEY, 60_000, 1).admitted());
        }
        assertEquals(0.0, registry.counter("security.ratelimit.store_failures").count());
    }

    // ===== Concurrency =====

    @Test
    void shouldNeverAdmitMoreThanLimitUnderContention() throws Exception {
        int threads = 16;
        int callsPerThread = 25;
        int limit = 40;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Callable<Integer>> tasks = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                tasks.add(() -> {
                    int admitted = 0;
                    for (int i = 0; i < callsPerThread; i++) {
                        if (limiter.check(KEY, 60_000, limit).admitted()) {
                            admitted++;
                        }
                    }
                    return admitted;
                });
            }
            int total = 0;
            for (Future<Integer> f : pool.invokeAll(tasks)) {
                total += f.get();
            }
            assertEquals(limit, total);
        } finally {
            pool.shutdownNow();
        }
    }

    private static RateLimitStore failingStore() {
        return new RateLimitStore() {
            @Override
            public RateLimitState increment(String key, long windowMs, long now) {
                throw new RateLimitStoreException("connection refused");
            }

            @Override
            public String name() {
                return "failing";
            }
        };
    }
}
