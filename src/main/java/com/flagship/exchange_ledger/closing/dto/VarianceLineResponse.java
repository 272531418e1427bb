package com.flagship.exchange_ledger.closing.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.exchange_ledger.closing.VarianceLine;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class VarianceLineResponse {

    @JsonProperty("currency")
    String currency;

    @JsonProperty("expected")
    BigDecimal expected;

    @JsonProperty("actual")
    BigDecimal actual;

    @JsonProperty("variance")
    BigDecimal variance;

    public static VarianceLineResponse from(VarianceLine line) {
        return new VarianceLineResponse(line.getCurrency(), line.getExpected(), line.getActual(), line.getVariance());
    }
}
