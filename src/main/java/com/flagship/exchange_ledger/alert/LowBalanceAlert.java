package com.flagship.exchange_ledger.alert;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class LowBalanceAlert {
    UUID drawerId;
    String drawerName;
    String currency;
    BigDecimal balance;
    BigDecimal threshold;
}
