package com.flagship.exchange_ledger.common;

import com.flagship.exchange_ledger.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class AmountsTest {

    @Test
    @DisplayName("Amounts are normalized to two decimals")
    void testRequirePositive_Normalizes() {
        BigDecimal amount = Amounts.requirePositive("Amount", new BigDecimal("12.5"));
        assertEquals(new BigDecimal("12.50"), amount);
    }

    @Test
    @DisplayName("Zero, negative, missing and over-precise amounts are rejected")
    void testRequirePositive_Rejects() {
        assertThrows(ValidationException.class, () -> Amounts.requirePositive("Amount", BigDecimal.ZERO));
        assertThrows(ValidationException.class, () -> Amounts.requirePositive("Amount", new BigDecimal("-1")));
        assertThrows(ValidationException.class, () -> Amounts.requirePositive("Amount", null));
        assertThrows(ValidationException.class, () -> Amounts.requirePositive("Amount", new BigDecimal("1.005")));
    }

    @Test
    @DisplayName("Zero is a valid non-negative amount")
    void testRequireNonNegative() {
        assertEquals(new BigDecimal("0.00"), Amounts.requireNonNegative("New balance", BigDecimal.ZERO));
        assertThrows(ValidationException.class, () -> Amounts.requireNonNegative("New balance", new BigDecimal("-0.01")));
    }

    @Test
    @DisplayName("Rates are kept at six decimals")
    void testRequireRate() {
        assertEquals(new BigDecimal("1460.000000"), Amounts.requireRate("Applied rate", new BigDecimal("1460")));
        assertEquals(new BigDecimal("0.000001"), Amounts.requireRate("Applied rate", new BigDecimal("0.0000005")));
        assertThrows(ValidationException.class, () -> Amounts.requireRate("Applied rate", BigDecimal.ZERO));
    }

    @Test
    @DisplayName("Amounts beyond the storage column are rejected")
    void testRequirePositive_ColumnLimit() {
        assertEquals(new BigDecimal("9999999999999999.99"),
            Amounts.requirePositive("Amount", new BigDecimal("9999999999999999.99")));
        assertThrows(ValidationException.class,
            () -> Amounts.requirePositive("Amount", new BigDecimal("10000000000000000")));
        assertThrows(ValidationException.class,
            () -> Amounts.requireNonNegative("Counted USD", new BigDecimal("100000000000000000")));
        assertThrows(ValidationException.class,
            () -> Amounts.requireRate("Applied rate", new BigDecimal("1000000000000")));
    }

    @Test
    @DisplayName("Computed balances are checked against the storage column")
    void testRequireWithinLimit() {
        BigDecimal max = Amounts.MAX_MONEY;
        assertEquals(max, Amounts.requireWithinLimit("Balance", max));
        assertThrows(ValidationException.class,
            () -> Amounts.requireWithinLimit("Balance", max.add(new BigDecimal("0.01"))));
        assertThrows(ValidationException.class,
            () -> Amounts.requireWithinLimit("Profit", max.negate().subtract(new BigDecimal("0.01"))));
    }
}
