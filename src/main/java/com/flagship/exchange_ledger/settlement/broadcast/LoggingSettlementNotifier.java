package com.flagship.exchange_ledger.settlement.broadcast;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Used when the Kafka broadcast is switched off.
 */
@Component
@ConditionalOnProperty(name = "exchange.broadcast.kafka.enabled", havingValue = "false")
@Slf4j
public class LoggingSettlementNotifier implements SettlementNotifier {

    @Override
    public void publish(SettlementBroadcast broadcast) {
        log.info("Settlement broadcast: transactionId={}, drawerId={}, profit={}, dailyProfit={}, flagged={}",
                broadcast.getTransactionId(), broadcast.getDrawerId(), broadcast.getProfit(),
                broadcast.getDailyProfit(), broadcast.isFlagged());
    }
}
