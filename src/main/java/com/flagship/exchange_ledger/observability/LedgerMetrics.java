package com.flagship.exchange_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized metrics for drawer balance operations.
 *
 * Metrics exposed:
 * - ledger.cash_movements: deposits, withdrawals, adjustments and reconciliations by currency and outcome
 * - ledger.settlements: settlements by outcome
 * - ledger.settlements.flagged: settlements flagged by compliance, by action
 * - ledger.closings: submitted closings, tagged with whether a variance was recorded
 * - ledger.operation.latency: timer per operation
 * - idempotency.cache: hit/miss of settlement idempotency keys
 * - ledger.low_balance.alerts: gauge of currently open low-balance alerts
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final AtomicLong lowBalanceAlerts = new AtomicLong();

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        registry.gauge("ledger.low_balance.alerts", Tags.empty(), lowBalanceAlerts);
    }

    public void recordCashMovement(String type, String currency, String outcome) {
        registry.counter("ledger.cash_movements",
                "type", sanitizeTag(type),
                "currency", sanitizeTag(currency),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordSettlement(String outcome) {
        registry.counter("ledger.settlements",
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordFlaggedSettlement(String action) {
        registry.counter("ledger.settlements.flagged",
                "action", sanitizeTag(action)
        ).increment();
    }

    public void recordClosingSubmitted(boolean hasVariance) {
        registry.counter("ledger.closings",
                "variance", String.valueOf(hasVariance)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void updateLowBalanceAlerts(long count) {
        lowBalanceAlerts.set(count);
    }

    /**
     * Outcome tag for a failure: the exception's simple name, so the tag set stays bounded.
     */
    public static String outcomeOf(Exception e) {
        return e.getClass().getSimpleName();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
