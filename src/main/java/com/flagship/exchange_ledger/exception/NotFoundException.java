package com.flagship.exchange_ledger.exception;

/**
 * Unknown drawer, currency, customer, transaction or closing attempt.
 */
public class NotFoundException extends LedgerException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
