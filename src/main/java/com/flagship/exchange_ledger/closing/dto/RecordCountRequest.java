package com.flagship.exchange_ledger.closing.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Counted cash per currency code. Currencies left out count as zero.
 */
@Value
public class RecordCountRequest {

    @NotNull(message = "Counts are required")
    @JsonProperty("counts")
    Map<String, BigDecimal> counts;
}
