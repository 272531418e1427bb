package com.flagship.exchange_ledger.settlement.compliance;

import com.flagship.exchange_ledger.currency.Currency;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * An exchange that has passed the funds check but has not been written yet.
 */
@Value
public class PendingExchange {
    UUID drawerId;
    UUID operatorId;
    Currency currencyIn;
    Currency currencyOut;
    BigDecimal amountIn;
    BigDecimal amountOut;
    BigDecimal appliedRate;
}
