package com.flagship.exchange_ledger.balance;

import com.flagship.exchange_ledger.balance.dto.AdjustmentRequest;
import com.flagship.exchange_ledger.balance.dto.BalanceMutationResponse;
import com.flagship.exchange_ledger.balance.dto.BalanceResponse;
import com.flagship.exchange_ledger.balance.dto.CashMovementRequest;
import com.flagship.exchange_ledger.balance.dto.ReconcileRequest;
import com.flagship.exchange_ledger.operator.Operator;
import com.flagship.exchange_ledger.operator.OperatorRole;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Cash movements on a single drawer.
 *
 * Every POST here changes exactly one (drawer, currency) balance and returns the
 * ledger entry that records it.
 */
@RestController
@RequestMapping("/api/drawers/{drawerId}")
@RequiredArgsConstructor
public class BalanceController {

    private final DrawerBalanceService drawerBalanceService;

    @GetMapping("/balances")
    public List<BalanceResponse> getBalances(@PathVariable("drawerId") UUID drawerId) {
        return drawerBalanceService.getBalances(drawerId).stream()
            .map(BalanceResponse::from)
            .collect(Collectors.toList());
    }

    @PostMapping("/deposits")
    public ResponseEntity<BalanceMutationResponse> deposit(
            @PathVariable("drawerId") UUID drawerId,
            @Valid @RequestBody CashMovementRequest request,
            @RequestHeader(Operator.ID_HEADER) UUID operatorId,
            @RequestHeader(value = Operator.ROLE_HEADER, required = false) OperatorRole role) {

        BalanceMutationResult result = drawerBalanceService.deposit(
            drawerId, request.getCurrency(), request.getAmount(), request.getNotes(), Operator.of(operatorId, role));
        return ResponseEntity.status(HttpStatus.CREATED).body(BalanceMutationResponse.from(result));
    }

    @PostMapping("/withdrawals")
    public ResponseEntity<BalanceMutationResponse> withdraw(
            @PathVariable("drawerId") UUID drawerId,
            @Valid @RequestBody CashMovementRequest request,
            @RequestHeader(Operator.ID_HEADER) UUID operatorId,
            @RequestHeader(value = Operator.ROLE_HEADER, required = false) OperatorRole role) {

        BalanceMutationResult result = drawerBalanceService.withdraw(
            drawerId, request.getCurrency(), request.getAmount(), request.getNotes(), Operator.of(operatorId, role));
        return ResponseEntity.status(HttpStatus.CREATED).body(BalanceMutationResponse.from(result));
    }

    @PostMapping("/adjustments")
    public ResponseEntity<BalanceMutationResponse> adjust(
            @PathVariable("drawerId") UUID drawerId,
            @Valid @RequestBody AdjustmentRequest request,
            @RequestHeader(Operator.ID_HEADER) UUID operatorId,
            @RequestHeader(value = Operator.ROLE_HEADER, required = false) OperatorRole role) {

        BalanceMutationResult result = drawerBalanceService.adjust(
            drawerId, request.getCurrency(), request.getNewBalance(), request.getReason(), Operator.of(operatorId, role));
        return ResponseEntity.status(HttpStatus.CREATED).body(BalanceMutationResponse.from(result));
    }

    @PostMapping("/reconciliations")
    public ResponseEntity<Reconciliation> reconcile(
            @PathVariable("drawerId") UUID drawerId,
            @Valid @RequestBody ReconcileRequest request,
            @RequestHeader(Operator.ID_HEADER) UUID operatorId,
            @RequestHeader(value = Operator.ROLE_HEADER, required = false) OperatorRole role) {

        Reconciliation reconciliation = drawerBalanceService.reconcile(
            drawerId, request.getCurrency(), request.getActualBalance(), request.getNotes(), Operator.of(operatorId, role));
        return ResponseEntity.status(HttpStatus.CREATED).body(reconciliation);
    }

    @GetMapping("/reconciliations")
    public List<Reconciliation> getReconciliations(@PathVariable("drawerId") UUID drawerId) {
        return drawerBalanceService.getReconciliations(drawerId);
    }
}
