package com.flagship.exchange_ledger.settlement.compliance;

import com.flagship.exchange_ledger.settlement.customer.ResolvedCustomer;

/**
 * Rule evaluation for a pending exchange. Implementations must not write anything;
 * they run inside the settlement unit while the balance rows are locked.
 */
public interface ComplianceEvaluator {

    ComplianceVerdict evaluate(PendingExchange exchange, ResolvedCustomer customer);
}
