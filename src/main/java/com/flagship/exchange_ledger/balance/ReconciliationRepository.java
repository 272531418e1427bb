package com.flagship.exchange_ledger.balance;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class ReconciliationRepository {

    private final JdbcTemplate jdbcTemplate;

    @Transactional(propagation = Propagation.MANDATORY)
    public void insert(Reconciliation reconciliation) {
        jdbcTemplate.update(
            "INSERT INTO reconciliations (id, drawer_id, currency_code, expected_balance, actual_balance, " +
            "difference, status, notes, performed_by, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            reconciliation.getId(),
            reconciliation.getDrawerId(),
            reconciliation.getCurrency(),
            reconciliation.getExpectedBalance(),
            reconciliation.getActualBalance(),
            reconciliation.getDifference(),
            reconciliation.getStatus().name(),
            reconciliation.getNotes(),
            reconciliation.getPerformedBy(),
            Timestamp.from(reconciliation.getCreatedAt())
        );
    }

    /**
     * Reconciliations of a drawer, newest first, with the id of the ledger entry each one produced.
     */
    @Transactional(readOnly = true)
    public List<Reconciliation> findByDrawer(UUID drawerId) {
        return jdbcTemplate.query(
            "SELECT r.*, l.id AS ledger_entry_id FROM reconciliations r " +
            "LEFT JOIN ledger_entries l ON l.reference_type = 'RECONCILIATION' AND l.reference_id = r.id " +
            "WHERE r.drawer_id = ? ORDER BY r.created_at DESC",
            (rs, rowNum) -> new Reconciliation(
                rs.getObject("id", UUID.class),
                rs.getObject("drawer_id", UUID.class),
                rs.getString("currency_code"),
                rs.getBigDecimal("expected_balance"),
                rs.getBigDecimal("actual_balance"),
                rs.getBigDecimal("difference"),
                ReconciliationStatus.valueOf(rs.getString("status")),
                rs.getString("notes"),
                rs.getObject("performed_by", UUID.class),
                rs.getTimestamp("created_at").toInstant(),
                rs.getObject("ledger_entry_id", UUID.class)
            ),
            drawerId
        );
    }
}
