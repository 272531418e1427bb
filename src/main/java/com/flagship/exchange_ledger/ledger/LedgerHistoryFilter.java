package com.flagship.exchange_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Optional filters for ledger history. Dates are inclusive and interpreted in the business time zone.
 */
@Value
@Builder
public class LedgerHistoryFilter {
    String currency;
    EntryType type;
    LocalDate from;
    LocalDate to;

    public static LedgerHistoryFilter none() {
        return LedgerHistoryFilter.builder().build();
    }
}
