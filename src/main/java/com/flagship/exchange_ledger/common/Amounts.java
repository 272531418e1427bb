package com.flagship.exchange_ledger.common;

import com.flagship.exchange_ledger.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Money and rate normalisation.
 *
 * Balances and amounts are stored as NUMERIC(18,2); rates as NUMERIC(18,6).
 * Amounts with more than two decimals are rejected rather than rounded, so
 * the ledger never records a value the caller did not send.
 */
public final class Amounts {

    public static final int MONEY_SCALE = 2;
    public static final int RATE_SCALE = 6;

    /** Largest value a NUMERIC(18,2) column holds. */
    public static final BigDecimal MAX_MONEY = new BigDecimal("9999999999999999.99");

    /** Largest value a NUMERIC(18,6) column holds. */
    public static final BigDecimal MAX_RATE = new BigDecimal("999999999999.999999");

    private Amounts() {
    }

    public static BigDecimal requirePositive(String field, BigDecimal value) {
        BigDecimal normalized = requireMoney(field, value);
        if (normalized.signum() <= 0) {
            throw new ValidationException(field + " must be greater than zero");
        }
        return normalized;
    }

    public static BigDecimal requireNonNegative(String field, BigDecimal value) {
        BigDecimal normalized = requireMoney(field, value);
        if (normalized.signum() < 0) {
            throw new ValidationException(field + " cannot be negative");
        }
        return normalized;
    }

    public static BigDecimal requireRate(String field, BigDecimal value) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        if (value.signum() <= 0) {
            throw new ValidationException(field + " must be greater than zero");
        }
        BigDecimal normalized = value.setScale(RATE_SCALE, RoundingMode.HALF_UP);
        if (normalized.compareTo(MAX_RATE) > 0) {
            throw new ValidationException(field + " exceeds the maximum of " + MAX_RATE.toPlainString());
        }
        return normalized;
    }

    /**
     * Rejects a computed balance that no longer fits the balance column.
     */
    public static BigDecimal requireWithinLimit(String field, BigDecimal value) {
        if (value.abs().compareTo(MAX_MONEY) > 0) {
            throw new ValidationException(field + " would exceed the maximum of " + MAX_MONEY.toPlainString());
        }
        return value;
    }

    /**
     * Rounds a computed monetary value (profit) to storage scale.
     */
    public static BigDecimal round(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(MONEY_SCALE);
    }

    private static BigDecimal requireMoney(String field, BigDecimal value) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        BigDecimal normalized;
        try {
            normalized = value.setScale(MONEY_SCALE, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new ValidationException(field + " cannot have more than " + MONEY_SCALE + " decimal places");
        }
        if (normalized.abs().compareTo(MAX_MONEY) > 0) {
            throw new ValidationException(field + " exceeds the maximum of " + MAX_MONEY.toPlainString());
        }
        return normalized;
    }
}
