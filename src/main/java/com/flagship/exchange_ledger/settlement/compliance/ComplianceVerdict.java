package com.flagship.exchange_ledger.settlement.compliance;

import lombok.Value;

@Value
public class ComplianceVerdict {

    private static final ComplianceVerdict CLEAR = new ComplianceVerdict(false, null, null);

    boolean flagged;
    String reason;
    ComplianceAction action;

    public static ComplianceVerdict clear() {
        return CLEAR;
    }

    public static ComplianceVerdict flagged(String reason, ComplianceAction action) {
        return new ComplianceVerdict(true, reason, action);
    }

    public boolean isBlocking() {
        return flagged && action == ComplianceAction.BLOCK;
    }
}
