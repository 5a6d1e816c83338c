package com.flagship.wallet_ledger.transaction;

import com.flagship.wallet_ledger.ledger.LedgerEntry;
import lombok.Value;

/**
 * Outcome of applying a transaction: the stored entry and whether it was
 * created by this call or already existed under the same external id.
 */
@Value
public class TransactionResult {
    LedgerEntry entry;
    boolean replayed;

    public static TransactionResult created(LedgerEntry entry) {
        return new TransactionResult(entry, false);
    }

    public static TransactionResult replayed(LedgerEntry entry) {
        return new TransactionResult(entry, true);
    }
}
