package com.flagship.exchange_ledger.settlement.broadcast;

import com.flagship.exchange_ledger.settlement.ExchangeTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Sends the settlement broadcast once the settlement has committed.
 *
 * Failures are logged and dropped: a committed settlement stays committed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SettlementBroadcaster {

    private final ExchangeTransactionRepository transactionRepository;
    private final SettlementNotifier notifier;
    private final Clock clock;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public void onSettlementCompleted(SettlementCompletedEvent event) {
        try {
            notifier.publish(SettlementBroadcast.of(event.getTransaction(), dailyProfit(), event.getCorrelationId()));
        } catch (Exception e) {
            log.warn("Settlement broadcast skipped: transactionId={}, error={}",
                    event.getTransaction().getId(), e.getMessage());
        }
    }

    BigDecimal dailyProfit() {
        ZoneId zone = clock.getZone();
        LocalDate today = LocalDate.now(clock);
        return transactionRepository.sumProfitBetween(
            today.atStartOfDay(zone).toInstant(),
            today.plusDays(1).atStartOfDay(zone).toInstant());
    }
}
