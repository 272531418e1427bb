package com.flagship.exchange_ledger.settlement.customer;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * How the caller identified the customer of an exchange. Every field is optional;
 * an empty reference stands for a walk-in customer.
 */
@Value
@Builder
public class CustomerReference {
    UUID customerId;
    String phone;
    String name;
    String idType;
    String idNumber;

    public static CustomerReference anonymous() {
        return CustomerReference.builder().build();
    }

    public boolean isEmpty() {
        return customerId == null && isBlank(phone) && isBlank(name);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
