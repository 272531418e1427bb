package com.flagship.exchange_ledger.exception;

/**
 * The operator's role does not allow the requested operation.
 */
public class UnauthorizedException extends LedgerException {

    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
