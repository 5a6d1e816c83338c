package com.flagship.wallet_ledger.transaction;

import com.flagship.wallet_ledger.ledger.TransactionKind;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A validated request to apply one deposit or withdrawal.
 *
 * Invariants: externalId is non-blank, amount is positive with at most
 * {@value #MAX_INTEGER_DIGITS} integer digits and {@value #AMOUNT_SCALE} decimal places.
 * The amount is held at scale {@value #AMOUNT_SCALE}, the scale the ledger stores it with.
 * A null currency means the reference currency.
 */
@Value
public class ApplyTransactionCommand {
    public static final int AMOUNT_SCALE = 4;
    public static final int MAX_INTEGER_DIGITS = 16;

    String externalId;
    UUID walletId;
    TransactionKind kind;
    BigDecimal amount;
    String currency;
    Map<String, Object> metadata;

    private ApplyTransactionCommand(String externalId, UUID walletId, TransactionKind kind,
                                    BigDecimal amount, String currency, Map<String, Object> metadata) {
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("External id cannot be null or blank");
        }
        this.externalId = externalId;
        this.walletId = Objects.requireNonNull(walletId, "Wallet id is required");
        this.kind = Objects.requireNonNull(kind, "Transaction type is required");
        Objects.requireNonNull(amount, "Amount is required");
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        BigDecimal stripped = amount.stripTrailingZeros();
        if (stripped.scale() > AMOUNT_SCALE) {
            throw new IllegalArgumentException("Amount must have at most " + AMOUNT_SCALE + " decimal places");
        }
        if (stripped.precision() - stripped.scale() > MAX_INTEGER_DIGITS) {
            throw new IllegalArgumentException("Amount must have at most " + MAX_INTEGER_DIGITS + " integer digits");
        }
        this.amount = amount.setScale(AMOUNT_SCALE);
        this.currency = currency;
        this.metadata = metadata;
    }

    public static ApplyTransactionCommand of(String externalId, UUID walletId, TransactionKind kind,
                                             BigDecimal amount, String currency, Map<String, Object> metadata) {
        return new ApplyTransactionCommand(externalId, walletId, kind, amount, currency, metadata);
    }

    public static ApplyTransactionCommand deposit(String externalId, UUID walletId, BigDecimal amount, String currency) {
        return of(externalId, walletId, TransactionKind.DEPOSIT, amount, currency, null);
    }

    public static ApplyTransactionCommand withdrawal(String externalId, UUID walletId, BigDecimal amount, String currency) {
        return of(externalId, walletId, TransactionKind.WITHDRAWAL, amount, currency, null);
    }
}
