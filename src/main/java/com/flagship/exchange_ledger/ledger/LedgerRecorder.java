package com.flagship.exchange_ledger.ledger;

import com.flagship.exchange_ledger.balance.BalanceChange;
import com.flagship.exchange_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Appends ledger entries.
 *
 * Key principles:
 * - Append-only: this class has no update or delete path
 * - Must run inside the same transaction as the balance mutation it records,
 *   so a rollback removes both together (Propagation.MANDATORY)
 * - The entry must describe the mutation exactly: the type-implied delta of the
 *   amount has to equal balanceAfter - balanceBefore
 */
@Service
@Slf4j
public class LedgerRecorder {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final int notesMaxLength;

    public LedgerRecorder(JdbcTemplate jdbcTemplate,
                          Clock clock,
                          @Value("${exchange.notes.max-length:500}") int notesMaxLength) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        this.notesMaxLength = notesMaxLength;
    }

    /**
     * Records one balance mutation.
     *
     * @param change      before/after values observed under the row lock
     * @param type        event type
     * @param amount      positive amount for directional types, signed delta for ADJUSTMENT and RECONCILIATION
     * @param reference   originating transaction or reconciliation, or {@link LedgerReference#none()}
     * @param notes       optional free text
     * @param performedBy operator id
     * @return the persisted entry
     * @throws IllegalStateException if amount and type do not match the balance change
     * @throws ValidationException if the notes are too long
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerEntry record(BalanceChange change, EntryType type, BigDecimal amount,
                              LedgerReference reference, String notes, UUID performedBy) {
        if (!type.isSigned() && amount.signum() <= 0) {
            throw new IllegalStateException(type + " entries need a positive amount, got " + amount);
        }
        if (type.signedDelta(amount).compareTo(change.delta()) != 0) {
            throw new IllegalStateException(String.format(
                "%s entry of %s does not match balance change %s -> %s for %s",
                type, amount, change.getBalanceBefore(), change.getBalanceAfter(), change.getCurrency()));
        }

        UUID entryId = UUID.randomUUID();
        Instant createdAt = clock.instant();
        String trimmedNotes = normalizeNotes(notes);

        Long sequenceNumber = jdbcTemplate.queryForObject(
            "INSERT INTO ledger_entries (id, drawer_id, currency_code, entry_type, amount, balance_before, " +
            "balance_after, reference_type, reference_id, notes, performed_by, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) RETURNING sequence_number",
            Long.class,
            entryId,
            change.getDrawerId(),
            change.getCurrency(),
            type.name(),
            amount,
            change.getBalanceBefore(),
            change.getBalanceAfter(),
            reference.getType(),
            reference.getId(),
            trimmedNotes,
            performedBy,
            Timestamp.from(createdAt)
        );

        log.info("Ledger entry recorded: entryId={}, type={}, currency={}, amount={}, {} -> {}",
                entryId, type, change.getCurrency(), amount, change.getBalanceBefore(), change.getBalanceAfter());

        return new LedgerEntry(
            entryId,
            sequenceNumber != null ? sequenceNumber : 0L,
            change.getDrawerId(),
            change.getCurrency(),
            type,
            amount,
            change.getBalanceBefore(),
            change.getBalanceAfter(),
            reference.getType(),
            reference.getId(),
            trimmedNotes,
            performedBy,
            createdAt
        );
    }

    /**
     * Trims notes and enforces the configured maximum length; blank notes become null.
     */
    public String normalizeNotes(String notes) {
        if (notes == null || notes.isBlank()) {
            return null;
        }
        String trimmed = notes.trim();
        if (trimmed.length() > notesMaxLength) {
            throw new ValidationException("Notes cannot exceed " + notesMaxLength + " characters");
        }
        return trimmed;
    }
}
