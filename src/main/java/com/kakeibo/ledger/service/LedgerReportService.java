package com.kakeibo.ledger.service;

import com.kakeibo.ledger.domain.Account;
import com.kakeibo.ledger.domain.Transaction;
import com.kakeibo.ledger.dto.SummaryResponse;
import com.kakeibo.ledger.store.LedgerState;
import com.kakeibo.ledger.store.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.YearMonth;
import java.util.Objects;

/**
 * Read-only totals over the committed ledger.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerReportService {

    private final LedgerStore ledgerStore;

    public long totalBalance() {
        return ledgerStore.read(LedgerReportService::totalBalance);
    }

    /**
     * Sum of positive amounts dated within {@code periodPrefix} (e.g. "2024-05").
     */
    public long periodIncome(String periodPrefix) {
        return ledgerStore.read(state -> periodIncome(state, periodPrefix));
    }

    /**
     * Sum of negative amounts dated within {@code periodPrefix}, as a non-negative number.
     */
    public long periodExpense(String periodPrefix) {
        return ledgerStore.read(state -> periodExpense(state, periodPrefix));
    }

    public SummaryResponse summarize(YearMonth period) {
        String prefix = period.toString();
        log.debug("Summarizing ledger for {}", prefix);
        return ledgerStore.read(state -> SummaryResponse.builder()
                .period(prefix)
                .totalBalance(totalBalance(state))
                .income(periodIncome(state, prefix))
                .expense(periodExpense(state, prefix))
                .build());
    }

    private static long totalBalance(LedgerState state) {
        return state.getAccounts().stream()
                .map(Account::getBalance)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .sum();
    }

    private static long periodIncome(LedgerState state, String periodPrefix) {
        return state.getTransactions().stream()
                .filter(t -> inPeriod(t, periodPrefix))
                .mapToLong(Transaction::getAmount)
                .filter(amount -> amount > 0)
                .sum();
    }

    private static long periodExpense(LedgerState state, String periodPrefix) {
        return -state.getTransactions().stream()
                .filter(t -> inPeriod(t, periodPrefix))
                .mapToLong(Transaction::getAmount)
                .filter(amount -> amount < 0)
                .sum();
    }

    private static boolean inPeriod(Transaction transaction, String periodPrefix) {
        return transaction.getAmount() != null
                && transaction.getDate() != null
                && transaction.getDate().startsWith(periodPrefix);
    }
}
