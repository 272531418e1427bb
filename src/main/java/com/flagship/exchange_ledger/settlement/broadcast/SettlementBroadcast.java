package com.flagship.exchange_ledger.settlement.broadcast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.exchange_ledger.settlement.ExchangeTransaction;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Real-time notification of a committed settlement, with the business day's
 * profit across all drawers up to and including it.
 */
@Value
@Builder
public class SettlementBroadcast {

    public static final String EVENT_TYPE = "ExchangeSettled";

    @JsonProperty("event_type")
    String eventType;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("drawer_id")
    UUID drawerId;

    @JsonProperty("operator_id")
    UUID operatorId;

    @JsonProperty("currency_in")
    String currencyIn;

    @JsonProperty("amount_in")
    BigDecimal amountIn;

    @JsonProperty("currency_out")
    String currencyOut;

    @JsonProperty("amount_out")
    BigDecimal amountOut;

    @JsonProperty("applied_rate")
    BigDecimal appliedRate;

    @JsonProperty("profit")
    BigDecimal profit;

    @JsonProperty("flagged")
    boolean flagged;

    @JsonProperty("flag_reason")
    String flagReason;

    @JsonProperty("daily_profit")
    BigDecimal dailyProfit;

    @JsonProperty("settled_at")
    Instant settledAt;

    @JsonProperty("correlation_id")
    String correlationId;

    public static SettlementBroadcast of(ExchangeTransaction transaction, BigDecimal dailyProfit, String correlationId) {
        return SettlementBroadcast.builder()
            .eventType(EVENT_TYPE)
            .transactionId(transaction.getId())
            .drawerId(transaction.getDrawerId())
            .operatorId(transaction.getOperatorId())
            .currencyIn(transaction.getCurrencyIn())
            .amountIn(transaction.getAmountIn())
            .currencyOut(transaction.getCurrencyOut())
            .amountOut(transaction.getAmountOut())
            .appliedRate(transaction.getAppliedRate())
            .profit(transaction.getProfit())
            .flagged(transaction.isFlagged())
            .flagReason(transaction.getFlagReason())
            .dailyProfit(dailyProfit)
            .settledAt(transaction.getCreatedAt())
            .correlationId(correlationId)
            .build();
    }
}
