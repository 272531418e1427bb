package com.flagship.exchange_ledger.balance;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A per-currency cash count that was applied to the balance.
 *
 * {@code ledgerEntryId} is null for a BALANCED count, which changes nothing.
 */
@Value
public class Reconciliation {
    UUID id;
    UUID drawerId;
    String currency;
    BigDecimal expectedBalance;
    BigDecimal actualBalance;
    BigDecimal difference;
    ReconciliationStatus status;
    String notes;
    UUID performedBy;
    Instant createdAt;
    UUID ledgerEntryId;
}
