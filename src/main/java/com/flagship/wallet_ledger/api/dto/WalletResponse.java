package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.wallet.Wallet;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for a created wallet. The optimistic version is internal and not exposed.
 */
@Value
@Builder
public class WalletResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static WalletResponse from(Wallet wallet) {
        return WalletResponse.builder()
            .id(wallet.getId())
            .balance(wallet.getBalance())
            .currency(wallet.getCurrency())
            .createdAt(wallet.getCreatedAt())
            .updatedAt(wallet.getUpdatedAt())
            .build();
    }
}
