package com.flagship.exchange_ledger.ledger;

import com.flagship.exchange_ledger.common.PagedResponse;
import com.flagship.exchange_ledger.currency.CurrencyDirectory;
import com.flagship.exchange_ledger.drawer.DrawerService;
import com.flagship.exchange_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Read side of the ledger: filtered history and the balance-versus-ledger consistency check.
 */
@Service
@Slf4j
public class LedgerQueryService {

    private static final RowMapper<LedgerEntry> ENTRY_ROW_MAPPER = (rs, rowNum) -> new LedgerEntry(
        rs.getObject("id", UUID.class),
        rs.getLong("sequence_number"),
        rs.getObject("drawer_id", UUID.class),
        rs.getString("currency_code"),
        EntryType.valueOf(rs.getString("entry_type")),
        rs.getBigDecimal("amount"),
        rs.getBigDecimal("balance_before"),
        rs.getBigDecimal("balance_after"),
        rs.getString("reference_type"),
        rs.getObject("reference_id", UUID.class),
        rs.getString("notes"),
        rs.getObject("performed_by", UUID.class),
        rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;
    private final DrawerService drawerService;
    private final Clock clock;
    private final int defaultPageSize;
    private final int maxPageSize;

    public LedgerQueryService(JdbcTemplate jdbcTemplate,
                              DrawerService drawerService,
                              Clock clock,
                              @Value("${exchange.ledger.history.default-page-size:50}") int defaultPageSize,
                              @Value("${exchange.ledger.history.max-page-size:100}") int maxPageSize) {
        this.jdbcTemplate = jdbcTemplate;
        this.drawerService = drawerService;
        this.clock = clock;
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize = maxPageSize;
    }

    /**
     * Ledger history of one drawer, newest first.
     *
     * @param page 1-based page number, defaults to 1
     * @param size page size, defaults to {@code exchange.ledger.history.default-page-size}
     *             and is capped at {@code exchange.ledger.history.max-page-size}
     */
    @Transactional(readOnly = true)
    public PagedResponse<LedgerEntry> getLedgerHistory(UUID drawerId, LedgerHistoryFilter filter,
                                                       Integer page, Integer size) {
        drawerService.getDrawer(drawerId);

        int pageNumber = page == null ? 1 : page;
        int pageSize = size == null ? defaultPageSize : Math.min(size, maxPageSize);
        if (pageNumber < 1) {
            throw new ValidationException("Page must be 1 or greater");
        }
        if (pageSize < 1) {
            throw new ValidationException("Page size must be 1 or greater");
        }
        if (filter.getFrom() != null && filter.getTo() != null && filter.getFrom().isAfter(filter.getTo())) {
            throw new ValidationException("Start date must not be after end date");
        }

        StringBuilder where = new StringBuilder(" WHERE drawer_id = ?");
        List<Object> params = new ArrayList<>();
        params.add(drawerId);

        ZoneId zone = clock.getZone();
        if (filter.getCurrency() != null) {
            where.append(" AND currency_code = ?");
            params.add(CurrencyDirectory.normalize(filter.getCurrency()));
        }
        if (filter.getType() != null) {
            where.append(" AND entry_type = ?");
            params.add(filter.getType().name());
        }
        if (filter.getFrom() != null) {
            where.append(" AND created_at >= ?");
            params.add(Timestamp.from(filter.getFrom().atStartOfDay(zone).toInstant()));
        }
        if (filter.getTo() != null) {
            where.append(" AND created_at < ?");
            params.add(Timestamp.from(filter.getTo().plusDays(1).atStartOfDay(zone).toInstant()));
        }

        Long total = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries" + where, Long.class, params.toArray());

        List<Object> pageParams = new ArrayList<>(params);
        pageParams.add(pageSize);
        pageParams.add((long) (pageNumber - 1) * pageSize);

        List<LedgerEntry> entries = jdbcTemplate.query(
            "SELECT id, sequence_number, drawer_id, currency_code, entry_type, amount, balance_before, " +
            "balance_after, reference_type, reference_id, notes, performed_by, created_at " +
            "FROM ledger_entries" + where + " ORDER BY sequence_number DESC LIMIT ? OFFSET ?",
            ENTRY_ROW_MAPPER,
            pageParams.toArray()
        );

        return PagedResponse.of(entries, pageNumber, pageSize, total != null ? total : 0L);
    }

    /**
     * Entries that reference the given transaction or reconciliation, in write order.
     */
    @Transactional(readOnly = true)
    public List<LedgerEntry> findByReference(String referenceType, UUID referenceId) {
        return jdbcTemplate.query(
            "SELECT id, sequence_number, drawer_id, currency_code, entry_type, amount, balance_before, " +
            "balance_after, reference_type, reference_id, notes, performed_by, created_at " +
            "FROM ledger_entries WHERE reference_type = ? AND reference_id = ? ORDER BY sequence_number",
            ENTRY_ROW_MAPPER,
            referenceType, referenceId
        );
    }

    /**
     * Replays each currency's ledger of the drawer and compares it with the stored balance.
     * A report is inconsistent when the sum of deltas differs from the balance or
     * when an entry does not start where the previous one ended.
     */
    @Transactional(readOnly = true)
    public List<ConsistencyReport> verifyConsistency(UUID drawerId) {
        drawerService.getDrawer(drawerId);

        List<ConsistencyReport> reports = jdbcTemplate.query(
            "SELECT b.currency_code, b.balance, " +
            "       COALESCE(SUM(l.balance_after - l.balance_before), 0) AS ledger_total, " +
            "       COUNT(l.id) AS entry_count, " +
            "       COALESCE(SUM(CASE WHEN l.prev_after IS NOT NULL AND l.prev_after <> l.balance_before THEN 1 " +
            "                         WHEN l.prev_after IS NULL AND l.balance_before <> 0 THEN 1 ELSE 0 END), 0) AS chain_breaks " +
            "FROM drawer_balances b " +
            "LEFT JOIN (SELECT id, currency_code, balance_before, balance_after, " +
            "                  LAG(balance_after) OVER (PARTITION BY currency_code ORDER BY sequence_number) AS prev_after " +
            "           FROM ledger_entries WHERE drawer_id = ?) l ON l.currency_code = b.currency_code " +
            "WHERE b.drawer_id = ? " +
            "GROUP BY b.currency_code, b.balance " +
            "ORDER BY b.currency_code",
            (rs, rowNum) -> new ConsistencyReport(
                rs.getString("currency_code"),
                rs.getBigDecimal("balance"),
                rs.getBigDecimal("ledger_total"),
                rs.getLong("entry_count"),
                rs.getLong("chain_breaks")
            ),
            drawerId, drawerId
        );

        reports.stream()
            .filter(report -> !report.isConsistent())
            .forEach(report -> log.error("Ledger inconsistency detected: drawerId={}, currency={}, balance={}, ledgerTotal={}, chainBreaks={}",
                    drawerId, report.getCurrency(), report.getBalance(), report.getLedgerTotal(), report.getChainBreaks()));
        return reports;
    }

    public BigDecimal sumOfDeltas(UUID drawerId, String currency) {
        BigDecimal total = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(balance_after - balance_before), 0) FROM ledger_entries " +
            "WHERE drawer_id = ? AND currency_code = ?",
            BigDecimal.class,
            drawerId, currency
        );
        return total != null ? total : BigDecimal.ZERO;
    }
}
