package com.flagship.exchange_ledger.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * What a ledger entry points back to: the exchange transaction or
 * reconciliation that caused it. Deposits, withdrawals and adjustments stand on their own.
 */
@Value
public class LedgerReference {

    public static final String TRANSACTION = "TRANSACTION";
    public static final String RECONCILIATION = "RECONCILIATION";

    private static final LedgerReference NONE = new LedgerReference(null, null);

    String type;
    UUID id;

    public static LedgerReference transaction(UUID transactionId) {
        return new LedgerReference(TRANSACTION, transactionId);
    }

    public static LedgerReference reconciliation(UUID reconciliationId) {
        return new LedgerReference(RECONCILIATION, reconciliationId);
    }

    public static LedgerReference none() {
        return NONE;
    }
}
