package com.flagship.exchange_ledger.closing;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Permanent record of a submitted closing. Never updated after insert.
 */
@Value
public class ClosingReport {
    UUID id;
    UUID drawerId;
    LocalDate closingDate;
    UUID generatedBy;
    /** Time of the previous closing of the drawer, null for its first closing. */
    Instant periodStart;
    List<VarianceLine> entries;
    boolean hasVariance;
    String notes;
    Instant createdAt;
}
