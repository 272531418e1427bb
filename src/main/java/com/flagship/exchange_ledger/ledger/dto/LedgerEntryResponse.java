package com.flagship.exchange_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.exchange_ledger.ledger.EntryType;
import com.flagship.exchange_ledger.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class LedgerEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("sequence_number")
    long sequenceNumber;

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

    @JsonProperty("reference_type")
    String referenceType;

    @JsonProperty("reference_id")
    UUID referenceId;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("performed_by")
    UUID performedBy;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .sequenceNumber(entry.getSequenceNumber())
            .drawerId(entry.getDrawerId())
            .currency(entry.getCurrency())
            .type(entry.getType())
            .amount(entry.getAmount())
            .balanceBefore(entry.getBalanceBefore())
            .balanceAfter(entry.getBalanceAfter())
            .referenceType(entry.getReferenceType())
            .referenceId(entry.getReferenceId())
            .notes(entry.getNotes())
            .performedBy(entry.getPerformedBy())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
