package com.flagship.exchange_ledger.settlement.customer;

import java.util.UUID;

/**
 * Customer lookup and registration.
 *
 * Resolution runs in its own transaction and completes before settlement takes
 * any balance lock; a failure here means settlement never starts.
 */
public interface CustomerDirectory {

    /**
     * @throws com.flagship.exchange_ledger.exception.NotFoundException if an explicit customer id is unknown
     * @throws com.flagship.exchange_ledger.exception.ValidationException if the customer is blocked
     */
    ResolvedCustomer resolve(CustomerReference reference, UUID operatorId);
}
