package com.flagship.exchange_ledger.balance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class AdjustmentRequest {

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @NotNull(message = "New balance is required")
    @DecimalMin(value = "0", message = "New balance cannot be negative")
    @Digits(integer = 16, fraction = 2, message = "New balance must have at most 2 decimal places")
    @JsonProperty("new_balance")
    BigDecimal newBalance;

    // minimum length is enforced by the service, where it is configurable
    @NotBlank(message = "Reason is required")
    @Size(max = 500, message = "Reason cannot exceed 500 characters")
    @JsonProperty("reason")
    String reason;
}
