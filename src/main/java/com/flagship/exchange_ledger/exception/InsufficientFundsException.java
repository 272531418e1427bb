package com.flagship.exchange_ledger.exception;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A debit asked for more than the locked balance holds. Nothing was written.
 */
@Getter
public class InsufficientFundsException extends LedgerException {

    private final UUID drawerId;
    private final String currency;
    private final BigDecimal available;
    private final BigDecimal required;

    public InsufficientFundsException(UUID drawerId, String currency, BigDecimal available, BigDecimal required) {
        super(ErrorCode.INSUFFICIENT_FUNDS,
                String.format("Insufficient %s balance in drawer. Available: %s, Required: %s",
                        currency, available.toPlainString(), required.toPlainString()));
        this.drawerId = drawerId;
        this.currency = currency;
        this.available = available;
        this.required = required;
    }
}
