package com.flagship.exchange_ledger.ledger;

import java.math.BigDecimal;

/**
 * Kind of balance-affecting event.
 *
 * DEPOSIT, WITHDRAWAL and the two settlement legs carry a positive amount whose
 * direction is implied by the type. ADJUSTMENT and RECONCILIATION carry the
 * signed delta themselves.
 */
public enum EntryType {
    DEPOSIT(1),
    WITHDRAWAL(-1),
    ADJUSTMENT(0),
    TRANSACTION_IN(1),
    TRANSACTION_OUT(-1),
    RECONCILIATION(0);

    private final int direction;

    EntryType(int direction) {
        this.direction = direction;
    }

    public boolean isSigned() {
        return direction == 0;
    }

    /**
     * The balance delta an entry of this type with the given amount stands for.
     */
    public BigDecimal signedDelta(BigDecimal amount) {
        return direction < 0 ? amount.negate() : amount;
    }
}
