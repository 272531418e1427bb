package com.flagship.exchange_ledger.settlement.customer;

import lombok.Value;

import java.util.UUID;

/**
 * Outcome of customer resolution, handed to settlement as an immutable message.
 */
@Value
public class ResolvedCustomer {

    private static final ResolvedCustomer ANONYMOUS = new ResolvedCustomer(null, null, null, false);

    UUID id;
    String name;
    String phone;
    boolean created;

    public static ResolvedCustomer anonymous() {
        return ANONYMOUS;
    }

    public boolean isAnonymous() {
        return id == null;
    }
}
