package com.flagship.exchange_ledger.settlement;

import com.flagship.exchange_ledger.settlement.customer.CustomerReference;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class SettlementRequest {
    UUID operatorId;
    String currencyIn;
    String currencyOut;
    BigDecimal amountIn;
    BigDecimal amountOut;
    BigDecimal appliedRate;
    /** Optional; defaults to the applied rate. */
    BigDecimal marketRate;
    CustomerReference customer;
    String notes;
    /** Optional; a repeated key returns the transaction settled the first time. */
    String idempotencyKey;
}
