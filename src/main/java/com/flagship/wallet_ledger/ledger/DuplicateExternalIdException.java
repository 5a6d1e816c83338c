package com.flagship.wallet_ledger.ledger;

/**
 * Signals that another writer inserted an entry with the same external id first.
 * The engine resolves this by returning the winning entry.
 */
public class DuplicateExternalIdException extends RuntimeException {

    private final String externalId;

    public DuplicateExternalIdException(String externalId, Throwable cause) {
        super("Ledger entry already exists for external id " + externalId, cause);
        this.externalId = externalId;
    }

    public String getExternalId() {
        return externalId;
    }
}
