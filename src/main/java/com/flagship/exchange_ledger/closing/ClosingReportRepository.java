package com.flagship.exchange_ledger.closing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Closing reports, with their variance lines stored as a JSONB array.
 */
@Repository
@RequiredArgsConstructor
public class ClosingReportRepository {

    private static final TypeReference<List<VarianceLine>> LINES = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public void insert(ClosingReport report) {
        jdbcTemplate.update(
            "INSERT INTO closing_reports (id, drawer_id, closing_date, generated_by, period_start, entries, " +
            "has_variance, notes, created_at) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?)",
            report.getId(),
            report.getDrawerId(),
            Date.valueOf(report.getClosingDate()),
            report.getGeneratedBy(),
            report.getPeriodStart() != null ? Timestamp.from(report.getPeriodStart()) : null,
            writeLines(report.getEntries()),
            report.isHasVariance(),
            report.getNotes(),
            Timestamp.from(report.getCreatedAt())
        );
    }

    @Transactional(readOnly = true)
    public Optional<ClosingReport> findById(UUID reportId) {
        return jdbcTemplate.query("SELECT * FROM closing_reports WHERE id = ?", rowMapper(), reportId)
            .stream()
            .findFirst();
    }

    /**
     * Reports of a drawer, newest first.
     */
    @Transactional(readOnly = true)
    public List<ClosingReport> findByDrawer(UUID drawerId) {
        return jdbcTemplate.query(
            "SELECT * FROM closing_reports WHERE drawer_id = ? ORDER BY created_at DESC",
            rowMapper(), drawerId);
    }

    @Transactional(readOnly = true)
    public Optional<Instant> findLastClosingAt(UUID drawerId) {
        Timestamp last = jdbcTemplate.queryForObject(
            "SELECT MAX(created_at) FROM closing_reports WHERE drawer_id = ?", Timestamp.class, drawerId);
        return Optional.ofNullable(last).map(Timestamp::toInstant);
    }

    private RowMapper<ClosingReport> rowMapper() {
        return (rs, rowNum) -> {
            Timestamp periodStart = rs.getTimestamp("period_start");
            return new ClosingReport(
                rs.getObject("id", UUID.class),
                rs.getObject("drawer_id", UUID.class),
                rs.getDate("closing_date").toLocalDate(),
                rs.getObject("generated_by", UUID.class),
                periodStart != null ? periodStart.toInstant() : null,
                readLines(rs.getString("entries")),
                rs.getBoolean("has_variance"),
                rs.getString("notes"),
                rs.getTimestamp("created_at").toInstant()
            );
        };
    }

    private String writeLines(List<VarianceLine> lines) {
        try {
            return objectMapper.writeValueAsString(lines);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize closing lines", e);
        }
    }

    private List<VarianceLine> readLines(String json) {
        try {
            return objectMapper.readValue(json, LINES);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt closing report lines: " + json, e);
        }
    }
}
