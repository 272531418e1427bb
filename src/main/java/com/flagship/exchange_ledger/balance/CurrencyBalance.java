package com.flagship.exchange_ledger.balance;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class CurrencyBalance {
    UUID drawerId;
    String currency;
    BigDecimal balance;
    UUID lastUpdatedBy;
    Instant updatedAt;
}
