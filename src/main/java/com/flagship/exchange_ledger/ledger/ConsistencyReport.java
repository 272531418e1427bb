package com.flagship.exchange_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of replaying one (drawer, currency) ledger against its stored balance.
 */
@Value
public class ConsistencyReport {
    String currency;
    BigDecimal balance;
    BigDecimal ledgerTotal;
    long entryCount;
    /**
     * Entries whose balanceBefore differs from the previous entry's balanceAfter.
     */
    long chainBreaks;

    public boolean isConsistent() {
        return balance.compareTo(ledgerTotal) == 0 && chainBreaks == 0;
    }
}
