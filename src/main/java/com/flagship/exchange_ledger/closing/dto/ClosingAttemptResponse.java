package com.flagship.exchange_ledger.closing.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.exchange_ledger.closing.ClosingAttempt;
import com.flagship.exchange_ledger.closing.ClosingStep;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Value
@Builder
public class ClosingAttemptResponse {

    @JsonProperty("attempt_id")
    UUID attemptId;

    @JsonProperty("drawer_id")
    UUID drawerId;

    @JsonProperty("step")
    ClosingStep step;

    @JsonProperty("expected_balances")
    Map<String, BigDecimal> expectedBalances;

    @JsonProperty("last_closing_at")
    Instant lastClosingAt;

    @JsonProperty("counted")
    Map<String, BigDecimal> counted;

    @JsonProperty("lines")
    List<VarianceLineResponse> lines;

    @JsonProperty("has_variance")
    boolean hasVariance;

    @JsonProperty("report_id")
    UUID reportId;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ClosingAttemptResponse from(ClosingAttempt attempt) {
        return ClosingAttemptResponse.builder()
            .attemptId(attempt.getId())
            .drawerId(attempt.getDrawerId())
            .step(attempt.getStep())
            .expectedBalances(attempt.getExpected())
            .lastClosingAt(attempt.getLastClosingAt())
            .counted(attempt.getCounted())
            .lines(attempt.getLines().stream().map(VarianceLineResponse::from).collect(Collectors.toList()))
            .hasVariance(attempt.hasVariance())
            .reportId(attempt.getReportId())
            .updatedAt(attempt.getUpdatedAt())
            .build();
    }
}
