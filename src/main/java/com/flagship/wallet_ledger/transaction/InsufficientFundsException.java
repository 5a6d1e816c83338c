package com.flagship.wallet_ledger.transaction;

import com.flagship.wallet_ledger.common.exception.WalletLedgerException;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Thrown when a withdrawal would take the balance below zero. Not retried.
 */
public class InsufficientFundsException extends WalletLedgerException {

    private final UUID walletId;
    private final BigDecimal currentBalance;
    private final BigDecimal requestedAmount;

    public InsufficientFundsException(UUID walletId, BigDecimal currentBalance, BigDecimal requestedAmount) {
        super("INSUFFICIENT_FUNDS", String.format(
            "Insufficient funds in wallet %s. Balance: %s, requested: %s",
            walletId, currentBalance.toPlainString(), requestedAmount.toPlainString()));
        this.walletId = walletId;
        this.currentBalance = currentBalance;
        this.requestedAmount = requestedAmount;
    }

    public UUID getWalletId() {
        return walletId;
    }

    public BigDecimal getCurrentBalance() {
        return currentBalance;
    }

    public BigDecimal getRequestedAmount() {
        return requestedAmount;
    }

    public BigDecimal getShortfall() {
        return requestedAmount.subtract(currentBalance);
    }

    @Override
    public Map<String, String> getDetails() {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("wallet_id", walletId.toString());
        details.put("current_balance", currentBalance.toPlainString());
        details.put("requested_amount", requestedAmount.toPlainString());
        details.put("shortfall", getShortfall().toPlainString());
        return details;
    }
}
