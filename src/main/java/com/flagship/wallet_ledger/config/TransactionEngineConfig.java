package com.flagship.wallet_ledger.config;

import com.flagship.wallet_ledger.transaction.BackoffSleeper;
import com.flagship.wallet_ledger.transaction.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Retry settings for optimistic conflicts in the transaction engine.
 */
@Configuration
@Slf4j
public class TransactionEngineConfig {

    @Bean
    public RetryPolicy retryPolicy(@Value("${ledger.transaction.max-attempts:3}") int maxAttempts,
                                   @Value("${ledger.transaction.initial-backoff-ms:100}") long initialBackoffMs,
                                   @Value("${ledger.transaction.backoff-jitter:0.0}") double jitter) {
        log.info("Transaction retry policy: maxAttempts={}, initialBackoff={}ms, jitter={}",
                maxAttempts, initialBackoffMs, jitter);
        return new RetryPolicy(maxAttempts, Duration.ofMillis(initialBackoffMs), jitter);
    }

    @Bean
    public BackoffSleeper backoffSleeper() {
        return BackoffSleeper.threadSleep();
    }
}
