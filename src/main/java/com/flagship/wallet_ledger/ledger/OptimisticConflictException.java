package com.flagship.wallet_ledger.ledger;

import java.util.UUID;

/**
 * Signals that a wallet row changed between load and commit.
 * Recovered inside the transaction engine; never surfaced to callers.
 */
public class OptimisticConflictException extends RuntimeException {

    private final UUID walletId;
    private final long expectedVersion;

    public OptimisticConflictException(UUID walletId, long expectedVersion) {
        super(String.format("Wallet %s was modified concurrently (expected version %d)",
            walletId, expectedVersion));
        this.walletId = walletId;
        this.expectedVersion = expectedVersion;
    }

    public UUID getWalletId() {
        return walletId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
