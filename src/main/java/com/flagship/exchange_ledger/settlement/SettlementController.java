package com.flagship.exchange_ledger.settlement;

import com.flagship.exchange_ledger.operator.Operator;
import com.flagship.exchange_ledger.operator.OperatorRole;
import com.flagship.exchange_ledger.settlement.customer.CustomerReference;
import com.flagship.exchange_ledger.settlement.dto.SettleExchangeRequest;
import com.flagship.exchange_ledger.settlement.dto.SettlementResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Exchange settlement endpoints.
 *
 * POST is idempotent when an Idempotency-Key header is sent: a repeated key
 * returns the original transaction with 200 instead of 201.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class SettlementController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final SettlementService settlementService;

    @PostMapping("/api/settlements")
    public ResponseEntity<SettlementResponse> settle(
            @Valid @RequestBody SettleExchangeRequest request,
            @RequestHeader(Operator.ID_HEADER) UUID operatorId,
            @RequestHeader(value = Operator.ROLE_HEADER, required = false) OperatorRole role,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        Operator operator = Operator.of(operatorId, role);
        log.info("Received settlement request: {} {} in, {} {} out, idempotencyKey={}",
                request.getAmountIn(), request.getCurrencyIn(),
                request.getAmountOut(), request.getCurrencyOut(), idempotencyKey);

        SettlementResult result = settlementService.settle(SettlementRequest.builder()
            .operatorId(operator.getId())
            .currencyIn(request.getCurrencyIn())
            .currencyOut(request.getCurrencyOut())
            .amountIn(request.getAmountIn())
            .amountOut(request.getAmountOut())
            .appliedRate(request.getAppliedRate())
            .marketRate(request.getMarketRate())
            .customer(CustomerReference.builder()
                .customerId(request.getCustomerId())
                .phone(request.getCustomerPhone())
                .name(request.getCustomerName())
                .idType(request.getCustomerIdType())
                .idNumber(request.getCustomerIdNumber())
                .build())
            .notes(request.getNotes())
            .idempotencyKey(idempotencyKey)
            .build());

        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(SettlementResponse.from(result));
    }

    @GetMapping("/api/settlements/{transactionId}")
    public SettlementResponse getTransaction(@PathVariable("transactionId") UUID transactionId) {
        return SettlementResponse.from(settlementService.getTransaction(transactionId));
    }

    /**
     * Exchanges of one drawer on a business day; defaults to today.
     */
    @GetMapping("/api/drawers/{drawerId}/settlements")
    public List<SettlementResponse> listTransactions(
            @PathVariable("drawerId") UUID drawerId,
            @RequestParam(value = "date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return settlementService.listTransactions(drawerId, date).stream()
            .map(SettlementResponse::from)
            .collect(Collectors.toList());
    }
}
