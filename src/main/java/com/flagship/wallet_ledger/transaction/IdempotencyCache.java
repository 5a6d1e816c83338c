package com.flagship.wallet_ledger.transaction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis fast path for idempotency lookups: external id to ledger entry id.
 *
 * Strategy:
 * 1. Look in Redis first (fast, but can be unavailable)
 * 2. Fall back to the ledger store on a miss or on any Redis error
 * 3. Remember new entries after commit for future lookups
 *
 * The unique constraint on external_id in the database stays the source of truth;
 * this cache only saves a round-trip for replays.
 */
@Component
@ConditionalOnProperty(name = "ledger.idempotency.redis.enabled", havingValue = "true")
@Slf4j
public class IdempotencyCache {

    private static final String REDIS_KEY_PREFIX = "wallet-ledger:idempotency:";

    private final StringRedisTemplate redisTemplate;
    private final Duration ttl;

    public IdempotencyCache(StringRedisTemplate redisTemplate,
                            @Value("${ledger.idempotency.redis.ttl-hours:168}") long ttlHours) {
        this.redisTemplate = redisTemplate;
        this.ttl = Duration.ofHours(ttlHours);
    }

    /**
     * @return the entry id cached for this external id, empty on a miss or if Redis is unavailable
     */
    public Optional<UUID> lookup(String externalId) {
        try {
            String entryId = redisTemplate.opsForValue().get(REDIS_KEY_PREFIX + externalId);
            if (entryId != null) {
                log.debug("Idempotency key found in Redis: {}", externalId);
                return Optional.of(UUID.fromString(entryId));
            }
        } catch (Exception e) {
            log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                    externalId, e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Best effort; a failure here only costs a database lookup later.
     */
    public void remember(String externalId, UUID entryId) {
        try {
            redisTemplate.opsForValue().set(REDIS_KEY_PREFIX + externalId, entryId.toString(), ttl);
            log.debug("Stored idempotency key in Redis: {} -> {}", externalId, entryId);
        } catch (Exception e) {
            log.warn("Failed to store idempotency key in Redis: {}. Error: {}", externalId, e.getMessage());
        }
    }

    /**
     * Drops a cached mapping that pointed at a missing entry.
     */
    public void evict(String externalId) {
        try {
            redisTemplate.delete(REDIS_KEY_PREFIX + externalId);
        } catch (Exception e) {
            log.warn("Failed to evict idempotency key from Redis: {}. Error: {}", externalId, e.getMessage());
        }
    }
}
