package com.flagship.exchange_ledger.currency;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class Currency {
    String code;
    String name;
    boolean active;
    /**
     * Incoming amounts at or above this value are flagged for compliance review.
     */
    BigDecimal highValueThreshold;
}
