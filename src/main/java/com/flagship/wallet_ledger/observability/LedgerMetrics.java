package com.flagship.wallet_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for the transaction engine and reconciliation.
 *
 * Metrics exposed:
 * - ledger.transactions.applied: committed transactions, by kind and currency
 * - ledger.transactions.rejected: domain rejections, by error code
 * - ledger.idempotency: lookups, by result (hit, miss, race)
 * - ledger.optimistic.conflicts: lost compare-and-swap attempts
 * - ledger.retry.exhausted: transactions that ran out of attempts
 * - ledger.transaction.duration: end-to-end apply latency
 * - ledger.reconciliation: consistency checks, by result
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter optimisticConflicts;
    private final Counter retryExhausted;
    private final Timer transactionTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.optimisticConflicts = Counter.builder("ledger.optimistic.conflicts")
                .description("Wallet updates that lost a version check and were retried")
                .register(registry);

        this.retryExhausted = Counter.builder("ledger.retry.exhausted")
                .description("Transactions that failed after the maximum number of attempts")
                .register(registry);

        this.transactionTimer = Timer.builder("ledger.transaction.duration")
                .description("Time taken to apply a transaction, including retries")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordTransactionApplied(String kind, String currency) {
        registry.counter("ledger.transactions.applied",
                "kind", sanitizeTag(kind),
                "currency", sanitizeTag(currency)
        ).increment();
    }

    public void recordTransactionRejected(String errorCode) {
        registry.counter("ledger.transactions.rejected",
                "reason", sanitizeTag(errorCode)
        ).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("ledger.idempotency", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("ledger.idempotency", "result", "miss").increment();
    }

    /**
     * A concurrent duplicate won the unique constraint and its entry was returned.
     */
    public void recordIdempotencyRace() {
        registry.counter("ledger.idempotency", "result", "race").increment();
    }

    public void recordOptimisticConflict() {
        optimisticConflicts.increment();
    }

    public void recordRetryExhausted() {
        retryExhausted.increment();
    }

    public void recordTransactionDuration(long durationMs) {
        transactionTimer.record(Duration.ofMillis(durationMs));
    }

    public void recordReconciliation(boolean consistent) {
        registry.counter("ledger.reconciliation",
                "result", consistent ? "consistent" : "drift"
        ).increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
