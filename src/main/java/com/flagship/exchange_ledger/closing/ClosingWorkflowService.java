package com.flagship.exchange_ledger.closing;

import com.flagship.exchange_ledger.balance.BalanceStore;
import com.flagship.exchange_ledger.balance.CurrencyBalance;
import com.flagship.exchange_ledger.common.Amounts;
import com.flagship.exchange_ledger.common.UnitOfWork;
import com.flagship.exchange_ledger.currency.CurrencyDirectory;
import com.flagship.exchange_ledger.drawer.DrawerService;
import com.flagship.exchange_ledger.exception.NotFoundException;
import com.flagship.exchange_ledger.exception.ValidationException;
import com.flagship.exchange_ledger.ledger.LedgerRecorder;
import com.flagship.exchange_ledger.observability.CorrelationContext;
import com.flagship.exchange_ledger.observability.LedgerMetrics;
import com.flagship.exchange_ledger.operator.Operator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Drawer closing: overview, count, verify, submit.
 *
 * The first three steps read balances without locking and write nothing.
 * Submission writes only the closing report; balances are never corrected by
 * a closing. An administrator adjusts or a manager reconciles for that.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClosingWorkflowService {

    private final DrawerService drawerService;
    private final BalanceStore balanceStore;
    private final CurrencyDirectory currencyDirectory;
    private final LedgerRecorder ledgerRecorder;
    private final ClosingReportRepository reportRepository;
    private final ClosingAttemptRegistry attemptRegistry;
    private final UnitOfWork unitOfWork;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    /**
     * OVERVIEW: freezes the drawer's current balances as the expected values.
     */
    public ClosingAttempt startClosing(UUID drawerId, Operator operator) {
        drawerService.getDrawer(drawerId);

        Map<String, BigDecimal> expected = new HashMap<>();
        for (CurrencyBalance balance : balanceStore.findAllForDrawer(drawerId)) {
            expected.put(balance.getCurrency(), balance.getBalance());
        }
        Instant lastClosingAt = reportRepository.findLastClosingAt(drawerId).orElse(null);

        ClosingAttempt attempt = ClosingAttempt.start(drawerId, operator.getId(), expected, lastClosingAt, clock.instant());
        attemptRegistry.register(attempt);
        log.info("Closing started: attemptId={}, drawerId={}, currencies={}, lastClosingAt={}",
                attempt.getId(), drawerId, expected.size(), lastClosingAt);
        return attempt;
    }

    /**
     * COUNT: records counted amounts per currency. May be repeated until the attempt is verified.
     * A currency the drawer does not hold must exist and be active.
     */
    public ClosingAttempt recordCount(UUID attemptId, Map<String, BigDecimal> counts) {
        Map<String, BigDecimal> validCounts = normalizeCounts(counts);
        ClosingAttempt current = attemptRegistry.require(attemptId);
        validCounts.keySet().stream()
            .filter(code -> !current.getExpected().containsKey(code))
            .forEach(currencyDirectory::requireActive);
        ClosingAttempt counted = current.recordCount(validCounts, clock.instant());
        attemptRegistry.transition(current, counted);
        log.info("Closing count recorded: attemptId={}, currencies={}", attemptId, validCounts.size());
        return counted;
    }

    /**
     * VERIFY: computes variance per currency. A variance is a warning, never a blocker.
     */
    public ClosingAttempt verify(UUID attemptId) {
        ClosingAttempt current = attemptRegistry.require(attemptId);
        ClosingAttempt verified = current.verify(clock.instant());
        attemptRegistry.transition(current, verified);
        if (verified.hasVariance()) {
            log.warn("Closing variance detected: attemptId={}, drawerId={}, lines={}",
                    attemptId, verified.getDrawerId(), verified.getLines());
        }
        return verified;
    }

    /**
     * SUBMITTED: persists the closing report. A second submit of the same attempt fails.
     */
    public ClosingReport submit(UUID attemptId, String notes, Operator operator) {
        String validNotes = ledgerRecorder.normalizeNotes(notes);
        ClosingAttempt verified = attemptRegistry.require(attemptId);
        Instant now = clock.instant();

        UUID reportId = UUID.randomUUID();
        ClosingAttempt submitted = verified.submit(reportId, now);
        // claims the attempt before writing, so concurrent submits cannot both persist
        attemptRegistry.transition(verified, submitted);

        ClosingReport report = new ClosingReport(
            reportId,
            verified.getDrawerId(),
            LocalDate.now(clock),
            operator.getId(),
            verified.getLastClosingAt(),
            verified.getLines(),
            verified.hasVariance(),
            validNotes,
            now
        );

        MDC.put(CorrelationContext.DRAWER_ID_MDC_KEY, verified.getDrawerId().toString());
        try {
            unitOfWork.run("submitClosing", () -> reportRepository.insert(report));
        } catch (RuntimeException e) {
            attemptRegistry.transition(submitted, verified);
            log.error("Closing submission failed, attempt reopened for retry: attemptId={}, error={}",
                    attemptId, e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.DRAWER_ID_MDC_KEY);
        }

        ledgerMetrics.recordClosingSubmitted(report.isHasVariance());
        log.info("Closing submitted: reportId={}, drawerId={}, hasVariance={}",
                reportId, report.getDrawerId(), report.isHasVariance());
        return report;
    }

    public ClosingAttempt getAttempt(UUID attemptId) {
        return attemptRegistry.require(attemptId);
    }

    /**
     * Expected balances of a drawer, as a fresh closing attempt in OVERVIEW.
     */
    public ClosingAttempt getClosingSnapshot(UUID drawerId, Operator operator) {
        return startClosing(drawerId, operator);
    }

    /**
     * Runs a whole closing in one call: overview, count, verify and submit.
     */
    public ClosingReport submitClosing(UUID drawerId, Map<String, BigDecimal> counts, String notes, Operator operator) {
        Map<String, BigDecimal> validCounts = normalizeCounts(counts);
        ledgerRecorder.normalizeNotes(notes);

        ClosingAttempt attempt = startClosing(drawerId, operator);
        recordCount(attempt.getId(), validCounts);
        verify(attempt.getId());
        return submit(attempt.getId(), notes, operator);
    }

    public List<ClosingReport> listClosingReports(UUID drawerId) {
        drawerService.getDrawer(drawerId);
        return reportRepository.findByDrawer(drawerId);
    }

    public ClosingReport getClosingReport(UUID reportId) {
        return reportRepository.findById(reportId)
            .orElseThrow(() -> new NotFoundException("Closing report not found: " + reportId));
    }

    private static Map<String, BigDecimal> normalizeCounts(Map<String, BigDecimal> counts) {
        if (counts == null) {
            throw new ValidationException("Counts are required");
        }
        Map<String, BigDecimal> normalized = new HashMap<>();
        counts.forEach((currency, amount) -> {
            String code = CurrencyDirectory.normalize(currency);
            if (normalized.put(code, Amounts.requireNonNegative("Counted " + code, amount)) != null) {
                throw new ValidationException("Currency counted twice: " + code);
            }
        });
        return normalized;
    }
}
