package com.flagship.exchange_ledger.settlement;

import com.flagship.exchange_ledger.common.Amounts;
import com.flagship.exchange_ledger.settlement.compliance.ComplianceAction;
import com.flagship.exchange_ledger.settlement.compliance.ComplianceVerdict;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A settled currency exchange: the drawer received {@code amountIn} of
 * {@code currencyIn} and paid out {@code amountOut} of {@code currencyOut}.
 *
 * Immutable once created. Compliance fields are attached with
 * {@link #withCompliance(ComplianceVerdict)} before the row is written.
 */
@Value
public class ExchangeTransaction {
    UUID id;
    UUID drawerId;
    UUID operatorId;
    UUID customerId;
    String currencyIn;
    String currencyOut;
    BigDecimal amountIn;
    BigDecimal amountOut;
    BigDecimal appliedRate;
    BigDecimal marketRate;
    BigDecimal profit;
    boolean flagged;
    String flagReason;
    ComplianceAction complianceAction;
    String notes;
    Instant createdAt;

    /**
     * Prices a new exchange. A missing market rate defaults to the applied rate,
     * which makes the profit zero.
     */
    public static ExchangeTransaction price(UUID drawerId, UUID operatorId, UUID customerId,
                                            String currencyIn, String currencyOut,
                                            BigDecimal amountIn, BigDecimal amountOut,
                                            BigDecimal appliedRate, BigDecimal marketRate,
                                            String notes, Instant createdAt) {
        BigDecimal market = marketRate != null ? marketRate : appliedRate;
        return new ExchangeTransaction(
            UUID.randomUUID(), drawerId, operatorId, customerId,
            currencyIn, currencyOut, amountIn, amountOut,
            appliedRate, market, profitOf(appliedRate, market, amountIn),
            false, null, null, notes, createdAt
        );
    }

    /**
     * profit = (appliedRate - marketRate) * amountIn, rounded half-up to cents.
     */
    public static BigDecimal profitOf(BigDecimal appliedRate, BigDecimal marketRate, BigDecimal amountIn) {
        return Amounts.requireWithinLimit("Profit", Amounts.round(appliedRate.subtract(marketRate).multiply(amountIn)));
    }

    public ExchangeTransaction withCompliance(ComplianceVerdict verdict) {
        if (!verdict.isFlagged()) {
            return this;
        }
        return new ExchangeTransaction(
            id, drawerId, operatorId, customerId, currencyIn, currencyOut, amountIn, amountOut,
            appliedRate, marketRate, profit, true, verdict.getReason(), verdict.getAction(), notes, createdAt
        );
    }
}
