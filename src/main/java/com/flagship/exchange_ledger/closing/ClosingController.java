package com.flagship.exchange_ledger.closing;

import com.flagship.exchange_ledger.closing.dto.ClosingAttemptResponse;
import com.flagship.exchange_ledger.closing.dto.ClosingReportResponse;
import com.flagship.exchange_ledger.closing.dto.RecordCountRequest;
import com.flagship.exchange_ledger.closing.dto.SubmitClosingRequest;
import com.flagship.exchange_ledger.operator.Operator;
import com.flagship.exchange_ledger.operator.OperatorRole;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Drawer closing endpoints: the stepwise workflow under /api/closings and
 * the one-shot snapshot/submit pair under /api/drawers/{drawerId}.
 */
@RestController
@RequiredArgsConstructor
public class ClosingController {

    private final ClosingWorkflowService closingWorkflowService;

    @PostMapping("/api/drawers/{drawerId}/closings")
    public ResponseEntity<ClosingAttemptResponse> startClosing(
            @PathVariable("drawerId") UUID drawerId,
            @RequestHeader(Operator.ID_HEADER) UUID operatorId,
            @RequestHeader(value = Operator.ROLE_HEADER, required = false) OperatorRole role) {
        ClosingAttempt attempt = closingWorkflowService.startClosing(drawerId, Operator.of(operatorId, role));
        return ResponseEntity.status(HttpStatus.CREATED).body(ClosingAttemptResponse.from(attempt));
    }

    @GetMapping("/api/closings/{attemptId}")
    public ClosingAttemptResponse getAttempt(@PathVariable("attemptId") UUID attemptId) {
        return ClosingAttemptResponse.from(closingWorkflowService.getAttempt(attemptId));
    }

    @PutMapping("/api/closings/{attemptId}/count")
    public ClosingAttemptResponse recordCount(
            @PathVariable("attemptId") UUID attemptId,
            @Valid @RequestBody RecordCountRequest request) {
        return ClosingAttemptResponse.from(closingWorkflowService.recordCount(attemptId, request.getCounts()));
    }

    @PostMapping("/api/closings/{attemptId}/verify")
    public ClosingAttemptResponse verify(@PathVariable("attemptId") UUID attemptId) {
        return ClosingAttemptResponse.from(closingWorkflowService.verify(attemptId));
    }

    @PostMapping("/api/closings/{attemptId}/submit")
    public ResponseEntity<ClosingReportResponse> submit(
            @PathVariable("attemptId") UUID attemptId,
            @Valid @RequestBody(required = false) SubmitClosingRequest request,
            @RequestHeader(Operator.ID_HEADER) UUID operatorId,
            @RequestHeader(value = Operator.ROLE_HEADER, required = false) OperatorRole role) {
        String notes = request != null ? request.getNotes() : null;
        ClosingReport report = closingWorkflowService.submit(attemptId, notes, Operator.of(operatorId, role));
        return ResponseEntity.status(HttpStatus.CREATED).body(ClosingReportResponse.from(report));
    }

    @GetMapping("/api/drawers/{drawerId}/closing-snapshot")
    public ClosingAttemptResponse getClosingSnapshot(
            @PathVariable("drawerId") UUID drawerId,
            @RequestHeader(Operator.ID_HEADER) UUID operatorId,
            @RequestHeader(value = Operator.ROLE_HEADER, required = false) OperatorRole role) {
        return ClosingAttemptResponse.from(
            closingWorkflowService.getClosingSnapshot(drawerId, Operator.of(operatorId, role)));
    }

    @PostMapping("/api/drawers/{drawerId}/closing-reports")
    public ResponseEntity<ClosingReportResponse> submitClosing(
            @PathVariable("drawerId") UUID drawerId,
            @Valid @RequestBody SubmitClosingRequest request,
            @RequestHeader(Operator.ID_HEADER) UUID operatorId,
            @RequestHeader(value = Operator.ROLE_HEADER, required = false) OperatorRole role) {
        ClosingReport report = closingWorkflowService.submitClosing(
            drawerId, request.getCounts(), request.getNotes(), Operator.of(operatorId, role));
        return ResponseEntity.status(HttpStatus.CREATED).body(ClosingReportResponse.from(report));
    }

    @GetMapping("/api/drawers/{drawerId}/closing-reports")
    public List<ClosingReportResponse> listClosingReports(@PathVariable("drawerId") UUID drawerId) {
        return closingWorkflowService.listClosingReports(drawerId).stream()
            .map(ClosingReportResponse::from)
            .collect(Collectors.toList());
    }

    @GetMapping("/api/closing-reports/{reportId}")
    public ClosingReportResponse getClosingReport(@PathVariable("reportId") UUID reportId) {
        return ClosingReportResponse.from(closingWorkflowService.getClosingReport(reportId));
    }
}
