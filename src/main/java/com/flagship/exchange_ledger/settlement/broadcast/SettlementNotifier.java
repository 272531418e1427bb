package com.flagship.exchange_ledger.settlement.broadcast;

/**
 * Sink for settlement broadcasts. Best effort: implementations may throw,
 * and callers log the failure without affecting the settlement.
 */
public interface SettlementNotifier {

    void publish(SettlementBroadcast broadcast);
}
