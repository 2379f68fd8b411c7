package com.vanityhub.server.service.ratelimit;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import com.vanityhub.server.exception.RateLimitStoreException;
import com.vanityhub.server.service.CircuitBreakerRegistry;
import com.vanityhub.server.service.CircuitBreakerRegistry.CircuitBreaker;

/**
 * Counter store shared by all instances through Redis.
 *
 * Each key is a hash {@code {ws, count}} updated by a Lua script, so the
 * reset-and-increment is atomic on the Redis server. The key expires with its
 * window. Calls go through a circuit breaker so an unreachable Redis fails
 * fast instead of holding every request for a connect timeout.
 */
public class RedisRateLimitStore implements RateLimitStore {

    private static final Logger log = LoggerFactory.getLogger(RedisRateLimitStore.class);

    private static final String KEY_PREFIX = "vanityhub:ratelimit:";

    private static final String INCREMENT_LUA = """
            local now = tonumber(ARGV[1])
            local win = tonumber(ARGV[2])
            local ws = tonumber(redis.call('HGET', KEYS[1], 'ws'))
            if ws == nil or now >= ws + win then
              ws = now
              redis.call('HSET', KEYS[1], 'ws', ARGV[1], 'count', 0)
              redis.call('PEXPIRE', KEYS[1], win)
            end
            local c = redis.call('HINCRBY', KEYS[1], 'count', 1)
            return tostring(ws) .. ':' .. tostring(c)
            """;

    /** Replies {@code "<windowStart>:<count>"}. */
    private static final DefaultRedisScript<String> INCREMENT_SCRIPT =
            new DefaultRedisScript<>(INCREMENT_LUA, String.class);

    private final StringRedisTemplate redis;
    private final CircuitBreaker breaker;

    public RedisRateLimitStore(StringRedisTemplate redis, CircuitBreakerRegistry breakers) {
        this.redis = redis;
        this.breaker = breakers.get("redis-ratelimit", 5, 30_000);
    }

    @Override
    public RateLimitState increment(String key, long windowMs, long now) {
        if (!breaker.isCallPermitted()) {
            throw new RateLimitStoreException("Redis rate-limit store unavailable (circuit open)");
        }
        try {
            String reply = redis.execute(INCREMENT_SCRIPT,
                    List.of(KEY_PREFIX + key),
                    String.valueOf(now),
                    String.valueOf(windowMs));
            RateLimitState state = parseReply(reply, key);
            breaker.recordSuccess();
            return state;
        } catch (RateLimitStoreException e) {
            breaker.recordFailure();
            throw e;
        } catch (RuntimeException e) {
            breaker.recordFailure();
            log.debug("[RateLimit] Redis increment failed for {}: {}", key, e.getMessage());
            throw new RateLimitStoreException("Redis increment failed", e);
        }
    }

    static RateLimitState parseReply(String reply, String key) {
        int sep = reply == null ? -1 : reply.indexOf(':');
        if (sep <= 0 || sep == reply.length() - 1) {
            throw new RateLimitStoreException("Unexpected script reply for key " + key + ": " + reply);
        }
        try {
            return new RateLimitState(Long.parseLong(reply.substring(0, sep)),
                    Long.parseLong(reply.substring(sep + 1)));
        } catch (NumberFormatException e) {
            throw new RateLimitStoreException("Unexpected script reply for key " + key + ": " + reply, e);
        }
    }

    @Override
    public String name() {
        return "redis";
    }
}
