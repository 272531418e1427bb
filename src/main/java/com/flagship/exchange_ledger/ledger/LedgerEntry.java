package com.flagship.exchange_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable ledger entry.
 *
 * Entries are append-only: never updated or deleted (enforced by a database trigger).
 */
@Value
public class LedgerEntry {
    UUID id;
    long sequenceNumber;
    UUID drawerId;
    String currency;
    EntryType type;
    BigDecimal amount;
    BigDecimal balanceBefore;
    BigDecimal balanceAfter;
    String referenceType;
    UUID referenceId;
    String notes;
    UUID performedBy;
    Instant createdAt;

    public BigDecimal delta() {
        return balanceAfter.subtract(balanceBefore);
    }
}
