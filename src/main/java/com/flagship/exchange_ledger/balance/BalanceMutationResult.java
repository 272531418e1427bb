package com.flagship.exchange_ledger.balance;

import com.flagship.exchange_ledger.ledger.EntryType;
import com.flagship.exchange_ledger.ledger.LedgerEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of a single-currency balance mutation and the ledger entry that records it.
 */
@Value
public class BalanceMutationResult {
    UUID ledgerEntryId;
    UUID drawerId;
    String currency;
    EntryType type;
    BigDecimal amount;
    BigDecimal balanceBefore;
    BigDecimal balanceAfter;
    Instant recordedAt;

    public static BalanceMutationResult from(LedgerEntry entry) {
        return new BalanceMutationResult(
            entry.getId(),
            entry.getDrawerId(),
            entry.getCurrency(),
            entry.getType(),
            entry.getAmount(),
            entry.getBalanceBefore(),
            entry.getBalanceAfter(),
            entry.getCreatedAt()
        );
    }
}
