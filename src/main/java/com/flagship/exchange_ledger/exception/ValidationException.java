package com.flagship.exchange_ledger.exception;

/**
 * Malformed or missing input: amount, currency, rate, reason or notes.
 */
public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
