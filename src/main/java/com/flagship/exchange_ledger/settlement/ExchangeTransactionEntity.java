package com.flagship.exchange_ledger.settlement;

import com.flagship.exchange_ledger.settlement.compliance.ComplianceAction;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for settled exchanges.
 *
 * Rows are written once by settlement and never updated. The idempotency key
 * is a persistence concern and is passed separately to {@link #fromDomain}.
 */
@Entity
@Immutable
@Table(
    name = "exchange_transactions",
    indexes = {
        @Index(name = "idx_exchange_transactions_drawer_created", columnList = "drawer_id, created_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExchangeTransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "drawer_id", nullable = false, updatable = false)
    private UUID drawerId;

    @Column(name = "operator_id", nullable = false, updatable = false)
    private UUID operatorId;

    @Column(name = "customer_id", updatable = false)
    private UUID customerId;

    @Column(name = "currency_in", nullable = false, length = 3, updatable = false)
    private String currencyIn;

    @Column(name = "currency_out", nullable = false, length = 3, updatable = false)
    private String currencyOut;

    @Column(name = "amount_in", nullable = false, precision = 18, scale = 2, updatable = false)
    private BigDecimal amountIn;

    @Column(name = "amount_out", nullable = false, precision = 18, scale = 2, updatable = false)
    private BigDecimal amountOut;

    @Column(name = "applied_rate", nullable = false, precision = 18, scale = 6, updatable = false)
    private BigDecimal appliedRate;

    @Column(name = "market_rate", nullable = false, precision = 18, scale = 6, updatable = false)
    private BigDecimal marketRate;

    @Column(nullable = false, precision = 18, scale = 2, updatable = false)
    private BigDecimal profit;

    @Column(nullable = false, updatable = false)
    private boolean flagged;

    @Column(name = "flag_reason", updatable = false)
    private String flagReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "compliance_action", length = 20, updatable = false)
    private ComplianceAction complianceAction;

    @Column(length = 500, updatable = false)
    private String notes;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static ExchangeTransactionEntity fromDomain(ExchangeTransaction transaction, String idempotencyKey) {
        return new ExchangeTransactionEntity(
            transaction.getId(),
            transaction.getDrawerId(),
            transaction.getOperatorId(),
            transaction.getCustomerId(),
            transaction.getCurrencyIn(),
            transaction.getCurrencyOut(),
            transaction.getAmountIn(),
            transaction.getAmountOut(),
            transaction.getAppliedRate(),
            transaction.getMarketRate(),
            transaction.getProfit(),
            transaction.isFlagged(),
            transaction.getFlagReason(),
            transaction.getComplianceAction(),
            transaction.getNotes(),
            idempotencyKey,
            transaction.getCreatedAt()
        );
    }

    public ExchangeTransaction toDomain() {
        return new ExchangeTransaction(
            id, drawerId, operatorId, customerId, currencyIn, currencyOut, amountIn, amountOut,
            appliedRate, marketRate, profit, flagged, flagReason, complianceAction, notes, createdAt
        );
    }
}
