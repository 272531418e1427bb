package com.flagship.exchange_ledger.closing;

import com.flagship.exchange_ledger.common.Amounts;
import com.flagship.exchange_ledger.exception.InvalidStateTransitionException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

/**
 * One closing of one drawer, as an explicit state machine.
 *
 * Key principles:
 * - Step transitions are explicit and validated; nothing moves backwards
 * - Every transition returns a new instance
 * - Expected balances are frozen when the attempt starts
 */
@Value
public class ClosingAttempt {
    UUID id;
    UUID drawerId;
    UUID operatorId;
    ClosingStep step;
    Map<String, BigDecimal> expected;
    Instant lastClosingAt;
    Map<String, BigDecimal> counted;
    List<VarianceLine> lines;
    UUID reportId;
    Instant startedAt;
    Instant updatedAt;

    /**
     * Creates a new attempt in OVERVIEW.
     */
    public static ClosingAttempt start(UUID drawerId, UUID operatorId, Map<String, BigDecimal> expected,
                                       Instant lastClosingAt, Instant now) {
        return new ClosingAttempt(
            UUID.randomUUID(),
            drawerId,
            operatorId,
            ClosingStep.OVERVIEW,
            Collections.unmodifiableMap(new TreeMap<>(expected)),
            lastClosingAt,
            Collections.emptyMap(),
            Collections.emptyList(),
            null,
            now,
            now
        );
    }

    /**
     * Records the physical count. Allowed from OVERVIEW and again while in COUNT;
     * a later count replaces the earlier one.
     *
     * @throws InvalidStateTransitionException once the attempt is verified or submitted
     */
    public ClosingAttempt recordCount(Map<String, BigDecimal> counts, Instant now) {
        if (step != ClosingStep.OVERVIEW && step != ClosingStep.COUNT) {
            throw new InvalidStateTransitionException(String.format(
                "Cannot record a count for closing %s in %s step. Counts are only accepted before verification.",
                id, step));
        }
        return new ClosingAttempt(id, drawerId, operatorId, ClosingStep.COUNT, expected, lastClosingAt,
            Collections.unmodifiableMap(new TreeMap<>(counts)), Collections.emptyList(), null, startedAt, now);
    }

    /**
     * Computes the variance lines. Currencies that were expected but not counted
     * count as zero; counted currencies missing from the snapshot were expected at zero.
     *
     * @throws InvalidStateTransitionException unless the attempt is in COUNT
     */
    public ClosingAttempt verify(Instant now) {
        if (step != ClosingStep.COUNT) {
            throw new InvalidStateTransitionException(String.format(
                "Cannot verify closing %s in %s step. Only COUNT closings can be verified.", id, step));
        }
        TreeSet<String> currencies = new TreeSet<>(expected.keySet());
        currencies.addAll(counted.keySet());

        List<VarianceLine> computed = new ArrayList<>();
        for (String currency : currencies) {
            computed.add(VarianceLine.of(
                currency,
                expected.getOrDefault(currency, Amounts.zero()),
                counted.getOrDefault(currency, Amounts.zero())));
        }
        return new ClosingAttempt(id, drawerId, operatorId, ClosingStep.VERIFY, expected, lastClosingAt,
            counted, Collections.unmodifiableList(computed), null, startedAt, now);
    }

    /**
     * @throws InvalidStateTransitionException unless the attempt is in VERIFY
     */
    public ClosingAttempt submit(UUID reportId, Instant now) {
        if (step != ClosingStep.VERIFY) {
            throw new InvalidStateTransitionException(String.format(
                "Cannot submit closing %s in %s step. Only VERIFY closings can be submitted.", id, step));
        }
        return new ClosingAttempt(id, drawerId, operatorId, ClosingStep.SUBMITTED, expected, lastClosingAt,
            counted, lines, reportId, startedAt, now);
    }

    /**
     * Soft warning: submission is never blocked by variance.
     */
    public boolean hasVariance() {
        return lines.stream().anyMatch(VarianceLine::hasVariance);
    }

    public boolean isTerminal() {
        return step == ClosingStep.SUBMITTED;
    }
}
