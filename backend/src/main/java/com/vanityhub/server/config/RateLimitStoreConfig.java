package com.vanityhub.server.config;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import com.vanityhub.server.service.CircuitBreakerRegistry;
import com.vanityhub.server.service.ratelimit.InMemoryRateLimitStore;
import com.vanityhub.server.service.ratelimit.RateLimitStore;
import com.vanityhub.server.service.ratelimit.RedisRateLimitStore;

/**
 * Chooses the rate-limit counter store.
 *
 *   vanityhub.ratelimit.store=memory  (default) single instance
 *   vanityhub.ratelimit.store=redis   shared across instances
 */
@Configuration
public class RateLimitStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(RateLimitStoreConfig.class);

    @Bean
    @ConditionalOnProperty(name = "vanityhub.ratelimit.store", havingValue = "memory", matchIfMissing = true)
    public RateLimitStore inMemoryRateLimitStore(
            Clock clock,
            @Value("${vanityhub.ratelimit.eviction-grace-ms:60000}") long graceMs) {
        log.info("[RateLimit] Using in-memory counter store (per instance)");
        return new InMemoryRateLimitStore(clock, graceMs);
    }

    @Bean
    @ConditionalOnProperty(name = "vanityhub.ratelimit.store", havingValue = "redis")
    public RateLimitStore redisRateLimitStore(StringRedisTemplate redis, CircuitBreakerRegistry breakers) {
        log.info("[RateLimit] Using Redis counter store (shared)");
        return new RedisRateLimitStore(redis, breakers);
    }
}
