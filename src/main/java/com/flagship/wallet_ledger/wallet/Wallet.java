package com.flagship.wallet_ledger.wallet;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Wallet domain object.
 *
 * Balances are held in the reference currency and never go negative.
 * {@code version} exists only for optimistic concurrency and carries no domain meaning.
 * {@code openingBalance} is the balance the wallet was created with; it is not
 * backed by a ledger entry and is immutable.
 */
@Value
public class Wallet {
    UUID id;
    BigDecimal balance;
    BigDecimal openingBalance;
    String currency;
    long version;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new wallet at version 0.
     */
    public static Wallet open(UUID id, BigDecimal openingBalance, String currency, Instant now) {
        if (openingBalance == null || openingBalance.signum() < 0) {
            throw new IllegalArgumentException("Initial balance must be zero or positive");
        }
        return new Wallet(id, openingBalance, openingBalance, currency, 0L, now, now);
    }

    /**
     * Returns the state this wallet would have after one more committed mutation.
     * The version moves forward by exactly one.
     */
    public Wallet withBalance(BigDecimal newBalance, Instant now) {
        if (newBalance.signum() < 0) {
            throw new IllegalStateException(
                String.format("Wallet %s balance cannot become negative: %s", id, newBalance));
        }
        return new Wallet(id, newBalance, openingBalance, currency, version + 1, createdAt, now);
    }
}
