package com.flagship.wallet_ledger.transaction;

import com.flagship.wallet_ledger.common.exception.WalletLedgerException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Thrown when every attempt lost its version check. Transient: the caller may
 * resubmit with the same external id without risk of a double application.
 */
public class ConcurrencyExhaustedException extends WalletLedgerException {

    private final String externalId;
    private final UUID walletId;
    private final int attempts;

    public ConcurrencyExhaustedException(String externalId, UUID walletId, int attempts) {
        this(externalId, walletId, attempts, null);
    }

    public ConcurrencyExhaustedException(String externalId, UUID walletId, int attempts, Throwable cause) {
        super("CONCURRENCY_EXHAUSTED", String.format(
            "Transaction %s on wallet %s could not be applied after %d attempts",
            externalId, walletId, attempts), cause);
        this.externalId = externalId;
        this.walletId = walletId;
        this.attempts = attempts;
    }

    public String getExternalId() {
        return externalId;
    }

    public UUID getWalletId() {
        return walletId;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public Map<String, String> getDetails() {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("external_id", externalId);
        details.put("wallet_id", walletId.toString());
        details.put("attempts", String.valueOf(attempts));
        return details;
    }
}
