package com.flagship.exchange_ledger.alert;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequiredArgsConstructor
public class AlertController {

    private final LowBalanceMonitor lowBalanceMonitor;

    @GetMapping("/api/alerts/low-balance")
    public List<LowBalanceAlertResponse> getLowBalanceAlerts() {
        return lowBalanceMonitor.getLowBalanceAlerts().stream()
            .map(LowBalanceAlertResponse::from)
            .collect(Collectors.toList());
    }

    @Value
    public static class LowBalanceAlertResponse {

        @JsonProperty("drawer_id")
        UUID drawerId;

        @JsonProperty("drawer_name")
        String drawerName;

        @JsonProperty("currency")
        String currency;

        @JsonProperty("balance")
        BigDecimal balance;

        @JsonProperty("threshold")
        BigDecimal threshold;

        static LowBalanceAlertResponse from(LowBalanceAlert alert) {
            return new LowBalanceAlertResponse(alert.getDrawerId(), alert.getDrawerName(),
                alert.getCurrency(), alert.getBalance(), alert.getThreshold());
        }
    }
}
