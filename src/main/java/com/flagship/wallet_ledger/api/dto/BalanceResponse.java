package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.wallet.WalletBalance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class BalanceResponse {

    @JsonProperty("wallet_id")
    UUID walletId;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("last_updated_at")
    Instant lastUpdatedAt;

    public static BalanceResponse from(WalletBalance balance) {
        return BalanceResponse.builder()
            .walletId(balance.getWalletId())
            .balance(balance.getBalance())
            .currency(balance.getCurrency())
            .lastUpdatedAt(balance.getLastUpdatedAt())
            .build();
    }
}
