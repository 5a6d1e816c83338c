package com.flagship.wallet_ledger.transaction;

import com.flagship.wallet_ledger.common.exception.WalletLedgerException;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Thrown when a converted amount cannot be recorded: it rounds to zero in the
 * reference currency, or the resulting balance would not fit the ledger's precision.
 */
public class AmountOutOfRangeException extends WalletLedgerException {

    private final UUID walletId;
    private final BigDecimal amount;
    private final String currency;
    private final BigDecimal referenceAmount;

    public AmountOutOfRangeException(UUID walletId, BigDecimal amount, String currency,
                                     BigDecimal referenceAmount, String reason) {
        super("AMOUNT_OUT_OF_RANGE", String.format("Amount %s %s cannot be applied to wallet %s: %s",
            amount.toPlainString(), currency, walletId, reason));
        this.walletId = walletId;
        this.amount = amount;
        this.currency = currency;
        this.referenceAmount = referenceAmount;
    }

    public UUID getWalletId() {
        return walletId;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public BigDecimal getReferenceAmount() {
        return referenceAmount;
    }

    @Override
    public Map<String, String> getDetails() {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("wallet_id", walletId.toString());
        details.put("amount", amount.toPlainString());
        details.put("currency", currency);
        details.put("reference_amount", referenceAmount.toPlainString());
        return details;
    }
}
