package com.flagship.exchange_ledger.balance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.exchange_ledger.balance.BalanceMutationResult;
import com.flagship.exchange_ledger.ledger.EntryType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class BalanceMutationResponse {

    @JsonProperty("ledger_entry_id")
    UUID ledgerEntryId;

    @JsonProperty("drawer_id")
    UUID drawerId;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("type")
    EntryType type;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("balance_before")
    BigDecimal balanceBefore;

    @JsonProperty("balance_after")
    BigDecimal balanceAfter;

    @JsonProperty("recorded_at")
    Instant recordedAt;

    public static BalanceMutationResponse from(BalanceMutationResult result) {
        return BalanceMutationResponse.builder()
            .ledgerEntryId(result.getLedgerEntryId())
            .drawerId(result.getDrawerId())
            .currency(result.getCurrency())
            .type(result.getType())
            .amount(result.getAmount())
            .balanceBefore(result.getBalanceBefore())
            .balanceAfter(result.getBalanceAfter())
            .recordedAt(result.getRecordedAt())
            .build();
    }
}
