package com.flagship.exchange_ledger.closing;

/**
 * Steps of a drawer closing. Transitions only move forward:
 * OVERVIEW -> COUNT (repeatable) -> VERIFY -> SUBMITTED.
 */
public enum ClosingStep {
    OVERVIEW,
    COUNT,
    VERIFY,
    SUBMITTED
}
