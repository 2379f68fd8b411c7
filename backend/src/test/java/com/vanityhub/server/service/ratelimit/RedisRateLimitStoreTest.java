package com.vanityhub.server.service.ratelimit;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import com.vanityhub.server.exception.RateLimitStoreException;
import com.vanityhub.server.service.CircuitBreakerRegistry;
import com.vanityhub.server.support.MutableClock;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RedisRateLimitStoreTest {

    private MutableClock clock;
    private StringRedisTemplate redis;
    private RedisRateLimitStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        redis = mock(StringRedisTemplate.class);
        store = new RedisRateLimitStore(redis, new CircuitBreakerRegistry(clock));
    }

    @Test
    void shouldParseScriptReply() {
        doReturn("1000:3").when(redis).execute(any(RedisScript.class),
                eq(List.of("vanityhub:ratelimit:ip:/api/x")), eq("1500"), eq("60000"));

        RateLimitState state = store.increment("ip:/api/x", 60_000, 1_500);

        assertEquals(new RateLimitState(1000, 3), state);
    }

    @Test
    void shouldWrapRedisErrors() {
        doThrow(new RedisConnectionFailureException("down")).when(redis)
                .execute(any(RedisScript.class), anyList(), anyString(), anyString());

        RateLimitStoreException e = assertThrows(RateLimitStoreException.class,
                () -> store.increment("k", 60_000, 1));
        assertInstanceOf(RedisConnectionFailureException.class, e.getCause());
    }

    @Test
    void shouldRejectMalformedReply() {
        doReturn("1000").when(redis)
                .execute(any(RedisScript.class), anyList(), anyString(), anyString());

        assertThrows(RateLimitStoreException.class, () -> store.increment("k", 60_000, 1));
    }

    @Test
    void shouldRejectNonNumericReply() {
        assertThrows(RateLimitStoreException.class, () -> RedisRateLimitStore.parseReply("abc:1", "k"));
        assertThrows(RateLimitStoreException.class, () -> RedisRateLimitStore.parseReply("1000:", "k"));
        assertThrows(RateLimitStoreException.class, () -> RedisRateLimitStore.parseReply(null, "k"));
    }

    @Test
    void shouldOpenCircuitAfterRepeatedFailures() {
        doThrow(new RedisConnectionFailureException("down")).when(redis)
                .execute(any(RedisScript.class), anyList(), anyString(), anyString());

        for (int i = 0; i < 5; i++) {
            assertThrows(RateLimitStoreException.class, () -> store.increment("k", 60_000, 1));
        }
        assertThrows(RateLimitStoreException.class, () -> store.increment("k", 60_000, 1));

        verify(redis, times(5)).execute(any(RedisScript.class), anyList(), anyString(), anyString());
    }

    @Test
    void shouldRetryStoreAfterCooldown() {
        doThrow(new RedisConnectionFailureException("down")).when(redis)
                .execute(any(RedisScript.class), anyList(), anyString(), anyString());
        for (int i = 0; i < 5; i++) {
            assertThrows(RateLimitStoreException.class, () -> store.increment("k", 60_000, 1));
        }

        clock.advanceMillis(30_000);
        doReturn("1:1").when(redis)
                .execute(any(RedisScript.class), anyList(), anyString(), anyString());

        assertEquals(new RateLimitState(1, 1), store.increment("k", 60_000, 1));
    }
}
