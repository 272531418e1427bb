package com.flagship.exchange_ledger.settlement.compliance;

/**
 * What a compliance rule asks for when it matches an exchange.
 * Settlement records the action; only BLOCK can abort, and only when enforcement is enabled.
 */
public enum ComplianceAction {
    FLAG,
    BLOCK,
    REQUIRE_APPROVAL,
    REQUIRE_ID
}
