package com.flagship.exchange_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.exchange_ledger.settlement.ExchangeTransaction;
import com.flagship.exchange_ledger.settlement.SettlementResult;
import com.flagship.exchange_ledger.settlement.compliance.ComplianceAction;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class SettlementResponse {

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("drawer_id")
    UUID drawerId;

    @JsonProperty("operator_id")
    UUID operatorId;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("currency_in")
    String currencyIn;

    @JsonProperty("currency_out")
    String currencyOut;

    @JsonProperty("amount_in")
    BigDecimal amountIn;

    @JsonProperty("amount_out")
    BigDecimal amountOut;

    @JsonProperty("applied_rate")
    BigDecimal appliedRate;

    @JsonProperty("market_rate")
    BigDecimal marketRate;

    @JsonProperty("profit")
    BigDecimal profit;

    @JsonProperty("flagged")
    boolean flagged;

    @JsonProperty("flag_reason")
    String flagReason;

    @JsonProperty("compliance_action")
    ComplianceAction complianceAction;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("updated_balances")
    Map<String, BigDecimal> updatedBalances;

    @JsonProperty("created_at")
    Instant createdAt;

    public static SettlementResponse from(SettlementResult result) {
        return base(result.getTransaction())
            .updatedBalances(result.getUpdatedBalances())
            .build();
    }

    public static SettlementResponse from(ExchangeTransaction transaction) {
        return base(transaction).build();
    }

    private static SettlementResponseBuilder base(ExchangeTransaction transaction) {
        return SettlementResponse.builder()
            .transactionId(transaction.getId())
            .drawerId(transaction.getDrawerId())
            .operatorId(transaction.getOperatorId())
            .customerId(transaction.getCustomerId())
            .currencyIn(transaction.getCurrencyIn())
            .currencyOut(transaction.getCurrencyOut())
            .amountIn(transaction.getAmountIn())
            .amountOut(transaction.getAmountOut())
            .appliedRate(transaction.getAppliedRate())
            .marketRate(transaction.getMarketRate())
            .profit(transaction.getProfit())
            .flagged(transaction.isFlagged())
            .flagReason(transaction.getFlagReason())
            .complianceAction(transaction.getComplianceAction())
            .notes(transaction.getNotes())
            .createdAt(transaction.getCreatedAt());
    }
}
