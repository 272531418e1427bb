package com.flagship.exchange_ledger.exception;

public class PersistenceFailureException extends LedgerException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILURE, message, cause);
    }
}
