package com.flagship.exchange_ledger.settlement;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Outcome of a settlement: the transaction, the balances of both legs after it,
 * and whether it was replayed from an earlier request with the same idempotency key.
 */
@Value
public class SettlementResult {
    ExchangeTransaction transaction;
    Map<String, BigDecimal> updatedBalances;
    boolean replayed;
}
