package com.flagship.exchange_ledger.exception;

/**
 * A closing attempt was driven out of order.
 */
public class InvalidStateTransitionException extends LedgerException {

    public InvalidStateTransitionException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }
}
