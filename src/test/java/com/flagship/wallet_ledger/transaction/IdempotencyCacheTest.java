package com.flagship.wallet_ledger.transaction;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IdempotencyCacheTest {

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOperations;
    private IdempotencyCache cache;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        cache = new IdempotencyCache(redisTemplate, 168);
    }

    @Test
    void hitReturnsEntryId() {
        UUID entryId = UUID.randomUUID();
        when(valueOperations.get("wallet-ledger:idempotency:ext-1")).thenReturn(entryId.toString());

        assertEquals(Optional.of(entryId), cache.lookup("ext-1"));
    }

    @Test
    void missReturnsEmpty() {
        when(valueOperations.get(anyString())).thenReturn(null);

        assertTrue(cache.lookup("ext-1").isEmpty());
    }

    @Test
    @DisplayName("Redis failures degrade to a miss instead of failing the request")
    void redisFailureIsAMiss() {
        when(valueOperations.get(anyString()))
            .thenThrow(new RedisConnectionFailureException("Redis unavailable"));

        assertTrue(cache.lookup("ext-1").isEmpty());
    }

    @Test
    @DisplayName("Keys are stored with the configured time-to-live")
    void rememberUsesTtl() {
        UUID entryId = UUID.randomUUID();

        cache.remember("ext-1", entryId);

        verify(valueOperations).set("wallet-ledger:idempotency:ext-1", entryId.toString(), Duration.ofHours(168));
    }

    @Test
    void rememberFailureIsSwallowed() {
        doThrow(new RedisConnectionFailureException("Redis unavailable"))
            .when(valueOperations).set(anyString(), anyString(), any(Duration.class));

        assertDoesNotThrow(() -> cache.remember("ext-1", UUID.randomUUID()));
    }

    @Test
    void evictDeletesKey() {
        cache.evict("ext-1");

        verify(redisTemplate).delete("wallet-ledger:idempotency:ext-1");
    }
}
