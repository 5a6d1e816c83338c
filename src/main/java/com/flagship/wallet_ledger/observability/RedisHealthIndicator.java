package com.flagship.wallet_ledger.observability;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Health of the Redis idempotency fast path.
 *
 * Redis being down degrades latency of replays only; the database lookup still
 * guarantees idempotency, so this indicator reports DEGRADED rather than DOWN.
 */
@Component("idempotencyCacheHealth")
@ConditionalOnProperty(name = "ledger.idempotency.redis.enabled", havingValue = "true")
public class RedisHealthIndicator implements HealthIndicator {

    private static final String FALLBACK_NOTE = "Idempotency falls back to the database";

    private final StringRedisTemplate redisTemplate;

    public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Health health() {
        RedisConnectionFactory connectionFactory = redisTemplate.getConnectionFactory();
        if (connectionFactory == null) {
            return Health.status("DEGRADED")
                    .withDetail("error", "No connection factory configured")
                    .withDetail("note", FALLBACK_NOTE)
                    .build();
        }

        try (RedisConnection connection = connectionFactory.getConnection()) {
            String result = connection.ping();
            if ("PONG".equals(result)) {
                return Health.up().withDetail("response", result).build();
            }
            return Health.status("DEGRADED")
                    .withDetail("response", result != null ? result : "null")
                    .withDetail("note", FALLBACK_NOTE)
                    .build();
        } catch (Exception e) {
            return Health.status("DEGRADED")
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .withDetail("note", FALLBACK_NOTE)
                    .build();
        }
    }
}
