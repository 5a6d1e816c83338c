package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.common.exception.WalletLedgerException;

import java.util.Map;
import java.util.UUID;

public class WalletNotFoundException extends WalletLedgerException {

    private final UUID walletId;

    public WalletNotFoundException(UUID walletId) {
        super("WALLET_NOT_FOUND", "Wallet with ID " + walletId + " not found");
        this.walletId = walletId;
    }

    public UUID getWalletId() {
        return walletId;
    }

    @Override
    public Map<String, String> getDetails() {
        return Map.of("wallet_id", String.valueOf(walletId));
    }
}
