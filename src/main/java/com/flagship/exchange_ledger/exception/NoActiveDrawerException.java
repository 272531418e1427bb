package com.flagship.exchange_ledger.exception;

import java.util.UUID;

public class NoActiveDrawerException extends LedgerException {

    public NoActiveDrawerException(UUID operatorId) {
        super(ErrorCode.NO_ACTIVE_DRAWER,
                "No active cash drawer found for operator " + operatorId + ". Please ask an administrator to assign one.");
    }
}
