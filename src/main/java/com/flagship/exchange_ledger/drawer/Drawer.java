package com.flagship.exchange_ledger.drawer;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A physical cash drawer.
 *
 * The low-balance threshold is a flat number applied to every currency in the
 * drawer; zero disables low-balance alerts for it.
 */
@Value
public class Drawer {
    UUID id;
    String name;
    String location;
    boolean active;
    BigDecimal lowBalanceThreshold;
    UUID assignedOperatorId;
    UUID createdBy;
    Instant createdAt;
    Instant updatedAt;
}
