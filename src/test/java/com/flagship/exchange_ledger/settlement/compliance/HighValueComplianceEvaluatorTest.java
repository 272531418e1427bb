package com.flagship.exchange_ledger.settlement.compliance;

import com.flagship.exchange_ledger.currency.Currency;
import com.flagship.exchange_ledger.settlement.customer.ResolvedCustomer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class HighValueComplianceEvaluatorTest {

    private static final Currency USD = new Currency("USD", "US Dollar", true, new BigDecimal("10000.00"));
    private static final Currency IQD = new Currency("IQD", "Iraqi Dinar", true, new BigDecimal("15000000.00"));

    private PendingExchange exchange(Currency in, String amountIn) {
        return new PendingExchange(UUID.randomUUID(), UUID.randomUUID(), in, IQD,
            new BigDecimal(amountIn), new BigDecimal("1.00"), new BigDecimal("1460"));
    }

    @Test
    @DisplayName("Amount at the threshold is flagged with the configured action")
    void testAtThreshold_Flagged() {
        HighValueComplianceEvaluator evaluator = new HighValueComplianceEvaluator(ComplianceAction.REQUIRE_ID);

        ComplianceVerdict verdict = evaluator.evaluate(exchange(USD, "10000.00"), ResolvedCustomer.anonymous());

        assertTrue(verdict.isFlagged());
        assertEquals("High Value Transaction (>= 10000 USD)", verdict.getReason());
        assertEquals(ComplianceAction.REQUIRE_ID, verdict.getAction());
        assertFalse(verdict.isBlocking());
    }

    @Test
    @DisplayName("Amount below the threshold is clear")
    void testBelowThreshold_Clear() {
        HighValueComplianceEvaluator evaluator = new HighValueComplianceEvaluator(ComplianceAction.BLOCK);

        ComplianceVerdict verdict = evaluator.evaluate(exchange(USD, "9999.99"), ResolvedCustomer.anonymous());

        assertFalse(verdict.isFlagged());
        assertNull(verdict.getReason());
    }

    @Test
    @DisplayName("BLOCK action produces a blocking verdict")
    void testBlockAction() {
        HighValueComplianceEvaluator evaluator = new HighValueComplianceEvaluator(ComplianceAction.BLOCK);

        ComplianceVerdict verdict = evaluator.evaluate(exchange(IQD, "20000000.00"), ResolvedCustomer.anonymous());

        assertTrue(verdict.isBlocking());
        assertEquals("High Value Transaction (>= 15000000 IQD)", verdict.getReason());
    }

    @Test
    @DisplayName("Zero threshold disables the rule")
    void testZeroThreshold_Disabled() {
        HighValueComplianceEvaluator evaluator = new HighValueComplianceEvaluator(ComplianceAction.FLAG);
        Currency unlimited = new Currency("AED", "UAE Dirham", true, BigDecimal.ZERO);

        assertFalse(evaluator.evaluate(exchange(unlimited, "99999999.00"), ResolvedCustomer.anonymous()).isFlagged());
    }
}
