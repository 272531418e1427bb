package com.flagship.exchange_ledger.balance;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Before/after values of one balance mutation, as observed under the row lock.
 * Every BalanceChange is turned into exactly one ledger entry.
 */
@Value
public class BalanceChange {
    UUID drawerId;
    String currency;
    BigDecimal balanceBefore;
    BigDecimal balanceAfter;

    /**
     * Signed delta, positive for credits and negative for debits.
     */
    public BigDecimal delta() {
        return balanceAfter.subtract(balanceBefore);
    }
}
