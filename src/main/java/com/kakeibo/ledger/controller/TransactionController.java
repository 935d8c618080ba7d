package com.kakeibo.ledger.controller;

import com.kakeibo.ledger.domain.Transaction;
import com.kakeibo.ledger.dto.CreateTransactionRequest;
import com.kakeibo.ledger.dto.TransactionResponse;
import com.kakeibo.ledger.store.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private final LedgerStore ledgerStore;

    /**
     * Transactions by date, then id; undated or malformed dates come last.
     */
    @GetMapping
    public ResponseEntity<List<TransactionResponse>> getTransactions() {
        List<TransactionResponse> transactions = ledgerStore.listTransactions().stream()
                .map(TransactionResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(transactions);
    }

    @PostMapping
    public ResponseEntity<TransactionResponse> createTransaction(@Valid @RequestBody CreateTransactionRequest request) {
        log.info("Received transaction: date={}, account={}, amount={}",
                request.getDate(), request.getAccount(), request.getAmount());

        Transaction transaction = ledgerStore.addTransaction(
                request.getDate(), request.getAccount(), request.getAmount(), request.getMemo());

        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(transaction));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteTransaction(@PathVariable String id) {
        boolean removed = ledgerStore.deleteTransaction(id);
        log.info("DELETE /api/v1/transactions/{} removed={}", id, removed);
        return ResponseEntity.noContent().build();
    }
}
