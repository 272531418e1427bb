package com.flagship.exchange_ledger.balance;

import java.math.BigDecimal;

public enum ReconciliationStatus {
    BALANCED,
    OVER,
    SHORT;

    /**
     * @param difference counted minus expected
     */
    public static ReconciliationStatus of(BigDecimal difference) {
        int sign = difference.signum();
        if (sign > 0) {
            return OVER;
        }
        return sign < 0 ? SHORT : BALANCED;
    }
}
