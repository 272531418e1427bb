package com.flagship.exchange_ledger.settlement.broadcast;

import com.flagship.exchange_ledger.settlement.ExchangeTransaction;
import lombok.Value;

/**
 * Published inside the settlement unit; listeners only see it once the unit commits.
 */
@Value
public class SettlementCompletedEvent {
    ExchangeTransaction transaction;
    String correlationId;
}
