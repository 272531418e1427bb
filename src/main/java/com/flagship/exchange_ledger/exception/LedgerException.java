package com.flagship.exchange_ledger.exception;

/**
 * Base class of every failure this service reports on purpose.
 *
 * Any LedgerException thrown inside a unit of work aborts the whole unit:
 * balances, ledger entries and transaction rows written so far are rolled back.
 */
public abstract class LedgerException extends RuntimeException {

    private final ErrorCode code;

    protected LedgerException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected LedgerException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    /**
     * Whether the caller may retry the same request unchanged.
     */
    public boolean isRetryable() {
        return code.isRetryable();
    }
}
