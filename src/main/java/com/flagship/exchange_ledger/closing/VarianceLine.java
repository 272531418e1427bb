package com.flagship.exchange_ledger.closing;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Expected, counted and variance (actual - expected) for one currency of a closing.
 */
@Value
public class VarianceLine {
    String currency;
    BigDecimal expected;
    BigDecimal actual;
    BigDecimal variance;

    public static VarianceLine of(String currency, BigDecimal expected, BigDecimal actual) {
        return new VarianceLine(currency, expected, actual, actual.subtract(expected));
    }

    public boolean hasVariance() {
        return variance.signum() != 0;
    }
}
