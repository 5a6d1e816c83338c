package com.flagship.wallet_ledger.wallet;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Read-only snapshot of a wallet's balance.
 */
@Value
public class WalletBalance {
    UUID walletId;
    BigDecimal balance;
    String currency;
    Instant lastUpdatedAt;
}
