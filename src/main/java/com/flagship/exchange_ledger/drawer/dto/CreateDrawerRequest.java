package com.flagship.exchange_ledger.drawer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class CreateDrawerRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 100, message = "Name cannot exceed 100 characters")
    @JsonProperty("name")
    String name;

    @Size(max = 200, message = "Location cannot exceed 200 characters")
    @JsonProperty("location")
    String location;

    @DecimalMin(value = "0", message = "Low balance threshold cannot be negative")
    @JsonProperty("low_balance_threshold")
    BigDecimal lowBalanceThreshold;
}
