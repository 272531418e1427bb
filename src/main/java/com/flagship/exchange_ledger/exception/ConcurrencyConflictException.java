package com.flagship.exchange_ledger.exception;

/**
 * Lock contention or lock timeout. The unit of work was rolled back and
 * the caller may safely retry.
 */
public class ConcurrencyConflictException extends LedgerException {

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(ErrorCode.CONCURRENCY_CONFLICT, message, cause);
    }
}
