package com.kakeibo.ledger.controller;

import com.kakeibo.ledger.dto.SummaryResponse;
import com.kakeibo.ledger.service.LedgerReportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.YearMonth;

@RestController
@RequestMapping("/api/v1/summary")
@RequiredArgsConstructor
@Slf4j
public class SummaryController {

    private final LedgerReportService ledgerReportService;
    private final Clock clock;

    @GetMapping
    public ResponseEntity<SummaryResponse> getSummary(@RequestParam(required = false) YearMonth period) {
        YearMonth month = period != null ? period : YearMonth.now(clock);
        log.info("GET /api/v1/summary?period={}", month);
        return ResponseEntity.ok(ledgerReportService.summarize(month));
    }
}
