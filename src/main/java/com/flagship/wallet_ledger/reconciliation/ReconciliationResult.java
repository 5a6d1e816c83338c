package com.flagship.wallet_ledger.reconciliation;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Stored balance of a wallet compared with the balance rebuilt from its ledger.
 *
 * {@code expectedBalance = openingBalance + ledgerTotal} and
 * {@code difference = storedBalance - expectedBalance}.
 */
@Value
public class ReconciliationResult {
    UUID walletId;
    BigDecimal storedBalance;
    BigDecimal openingBalance;
    BigDecimal ledgerTotal;
    BigDecimal expectedBalance;
    BigDecimal difference;
    boolean consistent;
}
