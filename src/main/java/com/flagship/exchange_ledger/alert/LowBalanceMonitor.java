package com.flagship.exchange_ledger.alert;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Derives low-balance alerts from current balances on every call.
 *
 * An alert is raised for each balance of an active drawer in an active currency
 * that is below the drawer's threshold. A threshold of zero disables alerts for
 * the drawer. Nothing is stored and nothing is locked.
 */
@Service
@RequiredArgsConstructor
public class LowBalanceMonitor {

    private static final String ALERT_CONDITION =
        "FROM drawer_balances b " +
        "JOIN drawers d ON d.id = b.drawer_id " +
        "JOIN currencies c ON c.code = b.currency_code " +
        "WHERE d.active AND c.active " +
        "AND d.low_balance_threshold > 0 AND b.balance < d.low_balance_threshold";

    private final JdbcTemplate jdbcTemplate;

    /**
     * Alerts ordered by balance, lowest first.
     */
    @Transactional(readOnly = true)
    public List<LowBalanceAlert> getLowBalanceAlerts() {
        return jdbcTemplate.query(
            "SELECT b.drawer_id, d.name, b.currency_code, b.balance, d.low_balance_threshold " +
            ALERT_CONDITION + " ORDER BY b.balance ASC, d.name ASC, b.currency_code ASC",
            (rs, rowNum) -> new LowBalanceAlert(
                rs.getObject("drawer_id", UUID.class),
                rs.getString("name"),
                rs.getString("currency_code"),
                rs.getBigDecimal("balance"),
                rs.getBigDecimal("low_balance_threshold")
            ));
    }

    @Transactional(readOnly = true)
    public long countAlerts() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) " + ALERT_CONDITION, Long.class);
        return count != null ? count : 0L;
    }
}
