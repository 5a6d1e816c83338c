package com.flagship.wallet_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Domain model for an applied transaction.
 *
 * Entries are append-only. {@code amount} and {@code currency} are the caller's values,
 * kept verbatim for audit. {@code referenceAmount} is the unsigned converted amount and
 * {@code appliedAmount} the signed impact on the balance; only the latter takes part
 * in reconciliation.
 */
@Value
public class LedgerEntry {
    UUID id;
    String externalId;
    UUID walletId;
    TransactionKind kind;
    BigDecimal amount;
    String currency;
    BigDecimal referenceAmount;
    BigDecimal appliedAmount;
    Map<String, Object> metadata;
    Instant createdAt;

    /**
     * Creates a new entry with a fresh id. The applied amount is derived from the kind.
     */
    public static LedgerEntry create(String externalId, UUID walletId, TransactionKind kind,
                                     BigDecimal amount, String currency, BigDecimal referenceAmount,
                                     Map<String, Object> metadata, Instant createdAt) {
        return new LedgerEntry(
            UUID.randomUUID(),
            externalId,
            walletId,
            kind,
            amount,
            currency,
            referenceAmount,
            kind.signed(referenceAmount),
            copyOf(metadata),
            createdAt
        );
    }

    /**
     * Metadata may hold JSON nulls, so {@link Map#copyOf} is not usable here.
     */
    static Map<String, Object> copyOf(Map<String, Object> metadata) {
        if (metadata == null) {
            return null;
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
