package com.flagship.exchange_ledger.ledger;

import com.flagship.exchange_ledger.common.PagedResponse;
import com.flagship.exchange_ledger.ledger.dto.LedgerEntryResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/drawers/{drawerId}/ledger")
@RequiredArgsConstructor
public class LedgerController {

    private final LedgerQueryService ledgerQueryService;

    @GetMapping
    public PagedResponse<LedgerEntryResponse> getLedgerHistory(
            @PathVariable("drawerId") UUID drawerId,
            @RequestParam(value = "currency", required = false) String currency,
            @RequestParam(value = "type", required = false) EntryType type,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "page", required = false) Integer page,
            @RequestParam(value = "size", required = false) Integer size) {

        LedgerHistoryFilter filter = LedgerHistoryFilter.builder()
            .currency(currency)
            .type(type)
            .from(from)
            .to(to)
            .build();

        PagedResponse<LedgerEntry> history = ledgerQueryService.getLedgerHistory(drawerId, filter, page, size);
        List<LedgerEntryResponse> data = history.getData().stream()
            .map(LedgerEntryResponse::from)
            .collect(Collectors.toList());
        return new PagedResponse<>(data, history.getPageNumber(), history.getPageSize(),
                history.getTotalRecords(), history.getTotalPages());
    }

    @GetMapping("/consistency")
    public List<ConsistencyReport> verifyConsistency(@PathVariable("drawerId") UUID drawerId) {
        return ledgerQueryService.verifyConsistency(drawerId);
    }
}
