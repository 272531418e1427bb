package com.flagship.exchange_ledger.drawer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Partial update: omitted fields are left unchanged.
 */
@Value
public class UpdateDrawerRequest {

    @Size(min = 1, max = 100, message = "Name must be between 1 and 100 characters")
    @JsonProperty("name")
    String name;

    @Size(max = 200, message = "Location cannot exceed 200 characters")
    @JsonProperty("location")
    String location;

    @JsonProperty("active")
    Boolean active;

    @DecimalMin(value = "0", message = "Low balance threshold cannot be negative")
    @JsonProperty("low_balance_threshold")
    BigDecimal lowBalanceThreshold;
}
