package com.flagship.exchange_ledger.operator;

import com.flagship.exchange_ledger.exception.UnauthorizedException;
import com.flagship.exchange_ledger.exception.ValidationException;
import lombok.Value;

import java.util.UUID;

/**
 * The authenticated person performing an operation.
 *
 * Authentication happens upstream; requests carry the resolved identity in the
 * {@value #ID_HEADER} and {@value #ROLE_HEADER} headers.
 */
@Value
public class Operator {

    public static final String ID_HEADER = "X-Operator-Id";
    public static final String ROLE_HEADER = "X-Operator-Role";

    UUID id;
    OperatorRole role;

    public static Operator of(UUID id, OperatorRole role) {
        if (id == null) {
            throw new ValidationException("Operator id is required");
        }
        return new Operator(id, role != null ? role : OperatorRole.EMPLOYEE);
    }

    public boolean isAdmin() {
        return role == OperatorRole.ADMIN;
    }

    public void requireAdmin(String operation) {
        if (!isAdmin()) {
            throw new UnauthorizedException("Only administrators may " + operation);
        }
    }

    public void requireManagerOrAdmin(String operation) {
        if (role != OperatorRole.ADMIN && role != OperatorRole.MANAGER) {
            throw new UnauthorizedException("Only managers or administrators may " + operation);
        }
    }
}
