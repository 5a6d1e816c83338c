package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.reconciliation.ReconciliationResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class ConsistencyResponse {

    @JsonProperty("wallet_id")
    UUID walletId;

    @JsonProperty("consistent")
    boolean consistent;

    @JsonProperty("stored_balance")
    BigDecimal storedBalance;

    @JsonProperty("opening_balance")
    BigDecimal openingBalance;

    @JsonProperty("ledger_total")
    BigDecimal ledgerTotal;

    @JsonProperty("difference")
    BigDecimal difference;

    public static ConsistencyResponse from(ReconciliationResult result) {
        return ConsistencyResponse.builder()
            .walletId(result.getWalletId())
            .consistent(result.isConsistent())
            .storedBalance(result.getStoredBalance())
            .openingBalance(result.getOpeningBalance())
            .ledgerTotal(result.getLedgerTotal())
            .difference(result.getDifference())
            .build();
    }
}
