package com.kakeibo.ledger.controller;

import com.kakeibo.ledger.domain.FixedCostTemplate;
import com.kakeibo.ledger.dto.CreateFixedCostRequest;
import com.kakeibo.ledger.dto.FixedCostResponse;
import com.kakeibo.ledger.dto.RecurringChargeResponse;
import com.kakeibo.ledger.service.RecurringChargeResult;
import com.kakeibo.ledger.service.RecurringChargeService;
import com.kakeibo.ledger.store.LedgerStore;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/fixed-costs")
public class FixedCostController {

    private static final Logger logger = LoggerFactory.getLogger(FixedCostController.class);

    private final LedgerStore ledgerStore;
    private final RecurringChargeService recurringChargeService;
    private final Clock clock;

    public FixedCostController(LedgerStore ledgerStore, RecurringChargeService recurringChargeService, Clock clock) {
        this.ledgerStore = ledgerStore;
        this.recurringChargeService = recurringChargeService;
        this.clock = clock;
    }

    @GetMapping
    public ResponseEntity<List<FixedCostResponse>> getFixedCosts() {
        List<FixedCostResponse> templates = ledgerStore.listTemplates().stream()
                .map(FixedCostResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(templates);
    }

    @PostMapping
    public ResponseEntity<FixedCostResponse> createFixedCost(@Valid @RequestBody CreateFixedCostRequest request) {
        logger.info("Received fixed cost template: name={}, account={}, day={}",
                request.getName(), request.getAccount(), request.getDay());

        FixedCostTemplate template = ledgerStore.addTemplate(
                request.getName(), request.getAccount(), request.getAmount(), request.getMemo(), request.getDay());

        return ResponseEntity.status(HttpStatus.CREATED).body(FixedCostResponse.from(template));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteFixedCost(@PathVariable String id) {
        boolean removed = ledgerStore.deleteTemplate(id);
        logger.info("DELETE /api/v1/fixed-costs/{} removed={}", id, removed);
        return ResponseEntity.noContent().build();
    }

    /**
     * Generate the current month's fixed-cost transactions that are due.
     * Safe to call repeatedly; already generated ones are reported as duplicates.
     */
    @PostMapping("/apply")
    public ResponseEntity<RecurringChargeResponse> applyFixedCosts(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {

        LocalDate today = date != null ? date : LocalDate.now(clock);
        logger.info("POST /api/v1/fixed-costs/apply date={}", today);

        RecurringChargeResult result = recurringChargeService.applyFixedCosts(today);
        return ResponseEntity.ok(RecurringChargeResponse.from(today.toString(), result));
    }
}
