package com.flagship.exchange_ledger.settlement.compliance;

import com.flagship.exchange_ledger.currency.Currency;
import com.flagship.exchange_ledger.settlement.customer.ResolvedCustomer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Flags exchanges whose incoming amount reaches the incoming currency's
 * high-value threshold. A threshold of zero or less disables the rule.
 */
@Component
@Slf4j
public class HighValueComplianceEvaluator implements ComplianceEvaluator {

    private final ComplianceAction action;

    public HighValueComplianceEvaluator(
            @Value("${exchange.compliance.high-value.action:FLAG}") ComplianceAction action) {
        this.action = action;
    }

    @Override
    public ComplianceVerdict evaluate(PendingExchange exchange, ResolvedCustomer customer) {
        Currency incoming = exchange.getCurrencyIn();
        BigDecimal threshold = incoming.getHighValueThreshold();
        if (threshold == null || threshold.signum() <= 0) {
            return ComplianceVerdict.clear();
        }
        if (exchange.getAmountIn().compareTo(threshold) < 0) {
            return ComplianceVerdict.clear();
        }

        String reason = String.format("High Value Transaction (>= %s %s)",
            threshold.stripTrailingZeros().toPlainString(), incoming.getCode());
        log.info("Compliance rule matched: reason={}, action={}, customerId={}",
                reason, action, customer.getId());
        return ComplianceVerdict.flagged(reason, action);
    }
}
