package com.flagship.exchange_ledger.balance;

import com.flagship.exchange_ledger.common.Amounts;
import com.flagship.exchange_ledger.exception.InsufficientFundsException;
import com.flagship.exchange_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Current balance per (drawer, currency).
 *
 * Locking discipline:
 * - Every mutation first takes {@code SELECT ... FOR UPDATE} on the exact row and
 *   validates against the value read under that lock.
 * - The lock is held until the surrounding unit of work commits or rolls back,
 *   which is why every mutating method requires an existing transaction.
 * - Callers touching two currencies use {@link #lockInOrder} so that all
 *   transactions acquire row locks in ascending currency-code order.
 *
 * Rows are created lazily on the first credit and never deleted. This class
 * never writes ledger entries itself; callers hand the returned
 * {@link BalanceChange} to the ledger recorder in the same unit of work.
 */
@Repository
@Slf4j
public class BalanceStore {

    private static final RowMapper<CurrencyBalance> BALANCE_ROW_MAPPER = (rs, rowNum) -> {
        Timestamp updatedAt = rs.getTimestamp("updated_at");
        return new CurrencyBalance(
            rs.getObject("drawer_id", UUID.class),
            rs.getString("currency_code"),
            rs.getBigDecimal("balance"),
            rs.getObject("last_updated_by", UUID.class),
            updatedAt != null ? updatedAt.toInstant() : null
        );
    };

    private static final String SELECT_BALANCE =
        "SELECT drawer_id, currency_code, balance, last_updated_by, updated_at FROM drawer_balances ";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final int reasonMinLength;

    public BalanceStore(JdbcTemplate jdbcTemplate,
                        Clock clock,
                        @Value("${exchange.adjustment.reason-min-length:5}") int reasonMinLength) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        this.reasonMinLength = reasonMinLength;
    }

    /**
     * Unlocked read of the committed balance; zero when the pair has never been credited.
     */
    @Transactional(readOnly = true)
    public BigDecimal getBalance(UUID drawerId, String currency) {
        return find(drawerId, currency)
            .map(CurrencyBalance::getBalance)
            .orElse(Amounts.zero());
    }

    @Transactional(readOnly = true)
    public Optional<CurrencyBalance> find(UUID drawerId, String currency) {
        List<CurrencyBalance> rows = jdbcTemplate.query(
            SELECT_BALANCE + "WHERE drawer_id = ? AND currency_code = ?",
            BALANCE_ROW_MAPPER,
            drawerId, currency
        );
        return rows.stream().findFirst();
    }

    @Transactional(readOnly = true)
    public List<CurrencyBalance> findAllForDrawer(UUID drawerId) {
        return jdbcTemplate.query(
            SELECT_BALANCE + "WHERE drawer_id = ? ORDER BY currency_code",
            BALANCE_ROW_MAPPER,
            drawerId
        );
    }

    /**
     * Locks the balance rows of several currencies of one drawer, creating
     * missing rows at zero, in ascending currency-code order.
     *
     * Two concurrent settlements over the same pair in opposite directions
     * therefore always queue on the same first row instead of deadlocking.
     *
     * @return the locked balances, in lock order
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<CurrencyBalance> lockInOrder(UUID drawerId, Collection<String> currencies) {
        List<CurrencyBalance> locked = new ArrayList<>();
        for (String currency : new TreeSet<>(currencies)) {
            locked.add(lockOrCreate(drawerId, currency));
        }
        return locked;
    }

    /**
     * Adds a positive amount, creating the row if this is the first credit.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BalanceChange credit(UUID drawerId, String currency, BigDecimal amount, UUID performedBy) {
        BigDecimal validAmount = Amounts.requirePositive("Amount", amount);

        BigDecimal before = lockOrCreate(drawerId, currency).getBalance();
        BigDecimal after = Amounts.requireWithinLimit("Balance", before.add(validAmount));
        write(drawerId, currency, after, performedBy);

        log.debug("Credited drawer balance: drawerId={}, currency={}, {} -> {}", drawerId, currency, before, after);
        return new BalanceChange(drawerId, currency, before, after);
    }

    /**
     * Subtracts a positive amount.
     *
     * @throws InsufficientFundsException if the locked balance is smaller than the amount;
     *         nothing is written in that case
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BalanceChange debit(UUID drawerId, String currency, BigDecimal amount, UUID performedBy) {
        BigDecimal validAmount = Amounts.requirePositive("Amount", amount);

        BigDecimal before = lock(drawerId, currency)
            .map(CurrencyBalance::getBalance)
            .orElse(Amounts.zero());
        if (validAmount.compareTo(before) > 0) {
            throw new InsufficientFundsException(drawerId, currency, before, validAmount);
        }
        BigDecimal after = before.subtract(validAmount);
        write(drawerId, currency, after, performedBy);

        log.debug("Debited drawer balance: drawerId={}, currency={}, {} -> {}", drawerId, currency, before, after);
        return new BalanceChange(drawerId, currency, before, after);
    }

    /**
     * Overwrites the balance with a counted or corrected value.
     *
     * The justification and the new value are validated before any lock is
     * taken, so a rejected call leaves no trace at all.
     *
     * @param reason justification, at least {@code exchange.adjustment.reason-min-length} characters
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BalanceChange setAbsolute(UUID drawerId, String currency, BigDecimal newBalance,
                                     String reason, UUID performedBy) {
        requireReason(reason);
        BigDecimal target = Amounts.requireNonNegative("New balance", newBalance);

        BigDecimal before = lockOrCreate(drawerId, currency).getBalance();
        write(drawerId, currency, target, performedBy);

        log.debug("Set drawer balance: drawerId={}, currency={}, {} -> {}", drawerId, currency, before, target);
        return new BalanceChange(drawerId, currency, before, target);
    }

    public void requireReason(String reason) {
        if (reason == null || reason.trim().length() < reasonMinLength) {
            throw new ValidationException(
                "A reason of at least " + reasonMinLength + " characters is required for balance adjustments");
        }
    }

    private Optional<CurrencyBalance> lock(UUID drawerId, String currency) {
        List<CurrencyBalance> rows = jdbcTemplate.query(
            SELECT_BALANCE + "WHERE drawer_id = ? AND currency_code = ? FOR UPDATE",
            BALANCE_ROW_MAPPER,
            drawerId, currency
        );
        return rows.stream().findFirst();
    }

    private CurrencyBalance lockOrCreate(UUID drawerId, String currency) {
        // a concurrent insert of the same pair blocks here until the other unit finishes
        jdbcTemplate.update(
            "INSERT INTO drawer_balances (drawer_id, currency_code, balance, updated_at) " +
            "VALUES (?, ?, 0, ?) ON CONFLICT (drawer_id, currency_code) DO NOTHING",
            drawerId, currency, Timestamp.from(clock.instant())
        );
        return lock(drawerId, currency)
            .orElseThrow(() -> new IllegalStateException(
                "Balance row vanished after insert: drawer=" + drawerId + ", currency=" + currency));
    }

    private void write(UUID drawerId, String currency, BigDecimal balance, UUID performedBy) {
        int updated = jdbcTemplate.update(
            "UPDATE drawer_balances SET balance = ?, last_updated_by = ?, updated_at = ? " +
            "WHERE drawer_id = ? AND currency_code = ?",
            balance, performedBy, Timestamp.from(clock.instant()), drawerId, currency
        );
        if (updated != 1) {
            throw new IllegalStateException(
                "Expected to update one balance row but updated " + updated + ": drawer=" + drawerId + ", currency=" + currency);
        }
    }
}
