package com.flagship.exchange_ledger.exception;

/**
 * Settlement refused because the compliance verdict was BLOCK and block enforcement is on.
 */
public class ComplianceBlockedException extends LedgerException {

    public ComplianceBlockedException(String message) {
        super(ErrorCode.COMPLIANCE_BLOCKED, message);
    }
}
