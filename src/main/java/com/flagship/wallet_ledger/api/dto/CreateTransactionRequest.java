package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.TransactionKind;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Request DTO for a deposit or withdrawal.
 *
 * external_id is the caller's idempotency key: resubmitting it returns the
 * original entry instead of applying the transaction again.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateTransactionRequest {

    @NotBlank(message = "External id is required")
    @Size(max = 255, message = "External id must be at most 255 characters")
    @JsonProperty("external_id")
    private String externalId;

    @NotNull(message = "Wallet id is required")
    @JsonProperty("wallet_id")
    private UUID walletId;

    @NotNull(message = "Transaction type is required")
    @JsonProperty("type")
    private TransactionKind type;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be at least 0.01")
    @Digits(integer = 16, fraction = 4, message = "Amount must have at most 16 integer digits and 4 decimal places")
    @JsonProperty("amount")
    private BigDecimal amount;

    @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    private String currency;

    @JsonProperty("metadata")
    private Map<String, Object> metadata;
}
