package com.kakeibo.ledger.store;

import com.kakeibo.ledger.domain.Account;
import com.kakeibo.ledger.domain.FixedCostTemplate;
import com.kakeibo.ledger.domain.Transaction;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The three ledger collections plus a record of which of them a mutation touched.
 *
 * The store hands mutations a deep copy, so changes only become visible once the
 * copy has been persisted and committed.
 */
public class LedgerState {

    private final List<Account> accounts;
    private final List<Transaction> transactions;
    private final List<FixedCostTemplate> templates;
    private final Set<LedgerCollection<?>> dirty = new LinkedHashSet<>();

    public LedgerState(List<Account> accounts, List<Transaction> transactions, List<FixedCostTemplate> templates) {
        this.accounts = new ArrayList<>(accounts);
        this.transactions = new ArrayList<>(transactions);
        this.templates = new ArrayList<>(templates);
    }

    public static LedgerState empty() {
        return new LedgerState(List.of(), List.of(), List.of());
    }

    public LedgerState copy() {
        return new LedgerState(
                copyAll(LedgerCollection.ACCOUNTS),
                copyAll(LedgerCollection.TRANSACTIONS),
                copyAll(LedgerCollection.FIXED_COSTS));
    }

    public List<Account> getAccounts() {
        return accounts;
    }

    public List<Transaction> getTransactions() {
        return transactions;
    }

    public List<FixedCostTemplate> getTemplates() {
        return templates;
    }

    public <T> List<T> records(LedgerCollection<T> collection) {
        return collection.recordsOf(this);
    }

    public <T> List<T> copyAll(LedgerCollection<T> collection) {
        return records(collection).stream()
                .map(collection::copy)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    public void markDirty(LedgerCollection<?> collection) {
        dirty.add(collection);
    }

    public boolean isDirty() {
        return !dirty.isEmpty();
    }

    public boolean isDirty(LedgerCollection<?> collection) {
        return dirty.contains(collection);
    }

    /**
     * Touched collections, in accounts / transactions / fixed costs order.
     */
    public List<LedgerCollection<?>> dirtyCollections() {
        return LedgerCollection.ALL.stream()
                .filter(dirty::contains)
                .collect(Collectors.toList());
    }

    /**
     * First account whose name equals {@code name} exactly.
     */
    public Optional<Account> findAccountByName(String name) {
        return accounts.stream()
                .filter(a -> a.getName() != null && a.getName().equals(name))
                .findFirst();
    }

    /**
     * First account whose trimmed name equals the trimmed {@code name}.
     */
    public Optional<Account> findAccountByTrimmedName(String name) {
        String wanted = name == null ? "" : name.strip();
        return accounts.stream()
                .filter(a -> a.getName() != null && a.getName().strip().equals(wanted))
                .findFirst();
    }

    public long balanceOf(Account account) {
        return account.getBalance() == null ? 0L : account.getBalance();
    }
}
