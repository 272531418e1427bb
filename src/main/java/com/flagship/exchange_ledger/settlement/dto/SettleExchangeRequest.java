package com.flagship.exchange_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Exchange settlement request. The drawer is the one assigned to the calling operator.
 * Customer fields are optional; leaving all of them empty records a walk-in customer.
 */
@Value
public class SettleExchangeRequest {

    @NotBlank(message = "Incoming currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency_in")
    String currencyIn;

    @NotBlank(message = "Outgoing currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency_out")
    String currencyOut;

    @NotNull(message = "Incoming amount is required")
    @DecimalMin(value = "0.01", message = "Incoming amount must be greater than 0")
    @Digits(integer = 16, fraction = 2, message = "Incoming amount must have at most 2 decimal places")
    @JsonProperty("amount_in")
    BigDecimal amountIn;

    @NotNull(message = "Outgoing amount is required")
    @DecimalMin(value = "0.01", message = "Outgoing amount must be greater than 0")
    @Digits(integer = 16, fraction = 2, message = "Outgoing amount must have at most 2 decimal places")
    @JsonProperty("amount_out")
    BigDecimal amountOut;

    @NotNull(message = "Applied rate is required")
    @DecimalMin(value = "0", inclusive = false, message = "Applied rate must be greater than 0")
    @JsonProperty("applied_rate")
    BigDecimal appliedRate;

    @DecimalMin(value = "0", inclusive = false, message = "Market rate must be greater than 0")
    @JsonProperty("market_rate")
    BigDecimal marketRate;

    @JsonProperty("customer_id")
    UUID customerId;

    @Size(max = 30, message = "Customer phone cannot exceed 30 characters")
    @JsonProperty("customer_phone")
    String customerPhone;

    @Size(max = 200, message = "Customer name cannot exceed 200 characters")
    @JsonProperty("customer_name")
    String customerName;

    @JsonProperty("customer_id_type")
    String customerIdType;

    @JsonProperty("customer_id_number")
    String customerIdNumber;

    @Size(max = 500, message = "Notes cannot exceed 500 characters")
    @JsonProperty("notes")
    String notes;
}
