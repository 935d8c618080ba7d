package com.kakeibo.ledger.controller;

import com.kakeibo.ledger.domain.Account;
import com.kakeibo.ledger.dto.AccountResponse;
import com.kakeibo.ledger.dto.CreateAccountRequest;
import com.kakeibo.ledger.store.LedgerStore;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/accounts")
public class AccountController {

    private static final Logger logger = LoggerFactory.getLogger(AccountController.class);

    private final LedgerStore ledgerStore;

    public AccountController(LedgerStore ledgerStore) {
        this.ledgerStore = ledgerStore;
    }

    @GetMapping
    public ResponseEntity<List<AccountResponse>> getAccounts() {
        List<AccountResponse> accounts = ledgerStore.listAccounts().stream()
                .map(AccountResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(accounts);
    }

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        logger.info("Received account creation request: name={}", request.getName());

        Account account = ledgerStore.addAccount(request.getName(), request.getOpeningBalance());

        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    /**
     * Delete an account. Its transactions stay recorded; deleting an unknown id is a no-op.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteAccount(@PathVariable String id) {
        boolean removed = ledgerStore.deleteAccount(id);
        logger.info("DELETE /api/v1/accounts/{} removed={}", id, removed);
        return ResponseEntity.noContent().build();
    }
}
