package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.LedgerEntry;
import com.flagship.wallet_ledger.ledger.TransactionKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("external_id")
    String externalId;

    @JsonProperty("wallet_id")
    UUID walletId;

    @JsonProperty("type")
    TransactionKind type;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("reference_amount")
    BigDecimal referenceAmount;

    @JsonProperty("applied_amount")
    BigDecimal appliedAmount;

    @JsonProperty("metadata")
    Map<String, Object> metadata;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionResponse from(LedgerEntry entry) {
        return TransactionResponse.builder()
            .id(entry.getId())
            .externalId(entry.getExternalId())
            .walletId(entry.getWalletId())
            .type(entry.getKind())
            .amount(entry.getAmount())
            .currency(entry.getCurrency())
            .referenceAmount(entry.getReferenceAmount())
            .appliedAmount(entry.getAppliedAmount())
            .metadata(entry.getMetadata())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
