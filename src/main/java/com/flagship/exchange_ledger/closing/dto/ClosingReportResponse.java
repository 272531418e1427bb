package com.flagship.exchange_ledger.closing.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.exchange_ledger.closing.ClosingReport;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Value
@Builder
public class ClosingReportResponse {

    @JsonProperty("report_id")
    UUID reportId;

    @JsonProperty("drawer_id")
    UUID drawerId;

    @JsonProperty("closing_date")
    LocalDate closingDate;

    @JsonProperty("generated_by")
    UUID generatedBy;

    @JsonProperty("period_start")
    Instant periodStart;

    @JsonProperty("entries")
    List<VarianceLineResponse> entries;

    @JsonProperty("has_variance")
    boolean hasVariance;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_at")
    Instant createdAt;

    public static ClosingReportResponse from(ClosingReport report) {
        return ClosingReportResponse.builder()
            .reportId(report.getId())
            .drawerId(report.getDrawerId())
            .closingDate(report.getClosingDate())
            .generatedBy(report.getGeneratedBy())
            .periodStart(report.getPeriodStart())
            .entries(report.getEntries().stream().map(VarianceLineResponse::from).collect(Collectors.toList()))
            .hasVariance(report.isHasVariance())
            .notes(report.getNotes())
            .createdAt(report.getCreatedAt())
            .build();
    }
}
