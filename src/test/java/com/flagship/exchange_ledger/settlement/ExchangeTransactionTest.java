package com.flagship.exchange_ledger.settlement;

import com.flagship.exchange_ledger.settlement.compliance.ComplianceAction;
import com.flagship.exchange_ledger.settlement.compliance.ComplianceVerdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ExchangeTransactionTest {

    private ExchangeTransaction price(String appliedRate, String marketRate, String amountIn) {
        return ExchangeTransaction.price(
            UUID.randomUUID(), UUID.randomUUID(), null,
            "USD", "IQD",
            new BigDecimal(amountIn), new BigDecimal("146000.00"),
            new BigDecimal(appliedRate), marketRate != null ? new BigDecimal(marketRate) : null,
            null, Instant.now());
    }

    @Test
    @DisplayName("Profit is (applied - market) * amountIn")
    void testProfit() {
        ExchangeTransaction transaction = price("1465.000000", "1460.000000", "100.00");

        assertEquals(new BigDecimal("500.00"), transaction.getProfit());
        assertEquals(new BigDecimal("1460.000000"), transaction.getMarketRate());
    }

    @Test
    @DisplayName("Missing market rate defaults to the applied rate and zero profit")
    void testProfit_DefaultMarketRate() {
        ExchangeTransaction transaction = price("1460.000000", null, "100.00");

        assertEquals(transaction.getAppliedRate(), transaction.getMarketRate());
        assertEquals(0, transaction.getProfit().signum());
        assertEquals(2, transaction.getProfit().scale());
    }

    @Test
    @DisplayName("Profit is rounded half-up to cents and may be negative")
    void testProfit_RoundingAndLoss() {
        assertEquals(new BigDecimal("0.13"),
            ExchangeTransaction.profitOf(new BigDecimal("1.000125"), new BigDecimal("1.000000"), new BigDecimal("1000.00")));
        assertEquals(new BigDecimal("-50.00"),
            ExchangeTransaction.profitOf(new BigDecimal("0.95"), new BigDecimal("1.00"), new BigDecimal("1000.00")));
    }

    @Test
    @DisplayName("Compliance verdict is attached only when flagged")
    void testWithCompliance() {
        ExchangeTransaction transaction = price("1460", null, "100.00");

        assertSame(transaction, transaction.withCompliance(ComplianceVerdict.clear()));

        ExchangeTransaction flagged = transaction.withCompliance(
            ComplianceVerdict.flagged("High Value Transaction (>= 10000 USD)", ComplianceAction.REQUIRE_ID));
        assertTrue(flagged.isFlagged());
        assertEquals(ComplianceAction.REQUIRE_ID, flagged.getComplianceAction());
        assertEquals(transaction.getId(), flagged.getId());
        assertFalse(transaction.isFlagged());
    }
}
