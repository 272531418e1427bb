package com.flagship.exchange_ledger.closing.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Submit body. {@code counts} is only read by the one-shot closing endpoint.
 */
@Value
public class SubmitClosingRequest {

    @JsonProperty("counts")
    Map<String, BigDecimal> counts;

    @Size(max = 500, message = "Notes cannot exceed 500 characters")
    @JsonProperty("notes")
    String notes;
}
