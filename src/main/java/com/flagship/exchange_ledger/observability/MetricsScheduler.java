package com.flagship.exchange_ledger.observability;

import com.flagship.exchange_ledger.alert.LowBalanceMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes gauges that need a database query, so a Prometheus scrape never does.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final LowBalanceMonitor lowBalanceMonitor;
    private final LedgerMetrics ledgerMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshLowBalanceAlerts() {
        try {
            ledgerMetrics.updateLowBalanceAlerts(lowBalanceMonitor.countAlerts());
        } catch (Exception e) {
            log.warn("Failed to refresh low balance gauge: {}", e.getMessage());
        }
    }
}
