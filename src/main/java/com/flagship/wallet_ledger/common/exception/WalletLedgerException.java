package com.flagship.wallet_ledger.common.exception;

import java.util.Map;

/**
 * Base type for domain errors surfaced to callers of the ledger.
 *
 * Every subclass carries a stable error code and structured details
 * (ids, amounts) so the transport layer can map it without parsing messages.
 */
public abstract class WalletLedgerException extends RuntimeException {

    private final String errorCode;

    protected WalletLedgerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected WalletLedgerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Structured context for the error response.
     */
    public Map<String, String> getDetails() {
        return Map.of();
    }
}
