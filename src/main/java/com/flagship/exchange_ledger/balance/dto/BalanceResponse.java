package com.flagship.exchange_ledger.balance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.exchange_ledger.balance.CurrencyBalance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class BalanceResponse {

    @JsonProperty("currency")
    String currency;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("last_updated_by")
    UUID lastUpdatedBy;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static BalanceResponse from(CurrencyBalance balance) {
        return BalanceResponse.builder()
            .currency(balance.getCurrency())
            .balance(balance.getBalance())
            .lastUpdatedBy(balance.getLastUpdatedBy())
            .updatedAt(balance.getUpdatedAt())
            .build();
    }
}
