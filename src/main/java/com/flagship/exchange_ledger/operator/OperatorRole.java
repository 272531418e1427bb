package com.flagship.exchange_ledger.operator;

public enum OperatorRole {
    ADMIN,
    MANAGER,
    EMPLOYEE
}
