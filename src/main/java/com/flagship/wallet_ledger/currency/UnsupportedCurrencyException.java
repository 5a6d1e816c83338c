package com.flagship.wallet_ledger.currency;

import com.flagship.wallet_ledger.common.exception.WalletLedgerException;

import java.util.Map;

/**
 * Thrown when a currency code has no entry in the rate table.
 */
public class UnsupportedCurrencyException extends WalletLedgerException {

    private final String currency;

    public UnsupportedCurrencyException(String currency) {
        super("UNSUPPORTED_CURRENCY", "Unsupported currency: " + currency);
        this.currency = currency;
    }

    public String getCurrency() {
        return currency;
    }

    @Override
    public Map<String, String> getDetails() {
        return Map.of("currency", String.valueOf(currency));
    }
}
