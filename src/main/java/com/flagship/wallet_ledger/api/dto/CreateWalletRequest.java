package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Request DTO for creating a wallet. Both fields are optional.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateWalletRequest {

    @DecimalMin(value = "0.00", message = "Initial balance must not be negative")
    @JsonProperty("initial_balance")
    private BigDecimal initialBalance;

    @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    private String currency;
}
