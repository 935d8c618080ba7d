package com.kakeibo.ledger.store;

import com.kakeibo.ledger.domain.Account;
import com.kakeibo.ledger.domain.FixedCostTemplate;
import com.kakeibo.ledger.domain.Transaction;
import com.kakeibo.ledger.exception.PersistenceException;
import com.kakeibo.ledger.exception.ValidationException;
import com.kakeibo.ledger.id.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Authoritative in-memory ledger for one session.
 *
 * Every mutation runs under the write lock against a deep copy of the committed state:
 * mutate, re-sort transactions, persist each touched collection, then commit. If
 * validation or persistence fails the committed state is left exactly as it was.
 *
 * Invariant after every commit: each account's balance equals its opening balance plus
 * the amounts of all transactions that were recorded against its name while it existed.
 */
public class LedgerStore {

    private static final Logger logger = LoggerFactory.getLogger(LedgerStore.class);

    private final LedgerRepository repository;
    private final IdGenerator idGenerator;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private LedgerState committed;

    LedgerStore(LedgerRepository repository, IdGenerator idGenerator, LedgerState initial) {
        this.repository = repository;
        this.idGenerator = idGenerator;
        this.committed = initial;
    }

    /**
     * Load all collections, backfill legacy records, sort transactions and persist them
     * straight away if anything was defaulted.
     */
    public static LedgerStore open(LedgerRepository repository, LedgerNormalizer normalizer, IdGenerator idGenerator) {
        List<Account> accounts = repository.load(LedgerCollection.ACCOUNTS);
        List<Transaction> transactions = repository.load(LedgerCollection.TRANSACTIONS);
        List<FixedCostTemplate> templates = repository.load(LedgerCollection.FIXED_COSTS);

        LedgerState state = new LedgerState(accounts, transactions, templates);
        boolean changed = normalizer.normalize(state.getAccounts(), state.getTransactions(), state.getTemplates());
        // sorted after backfill so the id tie-break sees the assigned ids
        TransactionOrdering.sort(state.getTransactions());
        if (changed) {
            for (LedgerCollection<?> collection : LedgerCollection.ALL) {
                saveCollection(repository, state, collection);
            }
            logger.info("Persisted normalized ledger collections");
        }

        logger.info("Opened ledger: {} accounts, {} transactions, {} fixed costs",
                accounts.size(), transactions.size(), templates.size());
        return new LedgerStore(repository, idGenerator, state);
    }

    public Account addAccount(String name, long openingBalance) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Account name is required");
        }
        String trimmed = name.strip();

        return mutate("add account", state -> {
            if (state.findAccountByName(trimmed).isPresent()) {
                logger.warn("Account name '{}' already exists; lookups by name will match the first one", trimmed);
            }
            Account account = new Account(idGenerator.newId(IdGenerator.ACCOUNT), trimmed, openingBalance);
            state.getAccounts().add(account);
            state.markDirty(LedgerCollection.ACCOUNTS);
            return account.copy();
        });
    }

    /**
     * Remove the account with {@code id}. Transactions naming it are left in place.
     *
     * @return whether an account was removed
     */
    public boolean deleteAccount(String id) {
        return mutate("delete account", state -> {
            boolean removed = state.getAccounts().removeIf(a -> a.getId().equals(id));
            if (removed) {
                state.markDirty(LedgerCollection.ACCOUNTS);
            }
            return removed;
        });
    }

    public FixedCostTemplate addTemplate(String name, String accountName, long amount, String memo, int day) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Fixed cost name is required");
        }
        if (day < FixedCostTemplate.MIN_DAY || day > FixedCostTemplate.MAX_DAY) {
            throw new ValidationException("Fixed cost day must be between 1 and 31, got " + day);
        }

        return mutate("add fixed cost", state -> {
            if (state.findAccountByName(accountName).isEmpty()) {
                throw new ValidationException("Account '" + accountName + "' does not exist");
            }
            FixedCostTemplate template = new FixedCostTemplate(
                    idGenerator.newId(IdGenerator.FIXED_COST),
                    name.strip(),
                    accountName,
                    amount,
                    memo == null ? "" : memo.strip(),
                    day);
            state.getTemplates().add(template);
            state.markDirty(LedgerCollection.FIXED_COSTS);
            return template.copy();
        });
    }

    public boolean deleteTemplate(String id) {
        return mutate("delete fixed cost", state -> {
            boolean removed = state.getTemplates().removeIf(t -> t.getId().equals(id));
            if (removed) {
                state.markDirty(LedgerCollection.FIXED_COSTS);
            }
            return removed;
        });
    }

    /**
     * Record a manual transaction. The balance of the first account named exactly
     * {@code accountName} moves by {@code amount}; with no such account the transaction
     * is still recorded and no balance changes.
     */
    public Transaction addTransaction(LocalDate date, String accountName, long amount, String memo) {
        if (date == null) {
            throw new ValidationException("Transaction date is required");
        }
        String account = accountName == null ? "" : accountName;

        return mutate("add transaction", state -> {
            Transaction transaction = new Transaction(
                    idGenerator.newId(IdGenerator.TRANSACTION),
                    date.toString(),
                    account,
                    amount,
                    memo == null ? "" : memo.strip());

            Optional<Account> target = state.findAccountByName(account);
            if (target.isPresent()) {
                Account a = target.get();
                a.setBalance(state.balanceOf(a) + amount);
                state.markDirty(LedgerCollection.ACCOUNTS);
            } else {
                logger.info("Transaction {} references unknown account '{}'; no balance adjusted",
                        transaction.getId(), account);
            }

            state.getTransactions().add(transaction);
            state.markDirty(LedgerCollection.TRANSACTIONS);
            return transaction.copy();
        });
    }

    /**
     * Remove a transaction, first reversing its amount on the first account whose name
     * matches the transaction's account exactly.
     *
     * @return whether a transaction was removed
     */
    public boolean deleteTransaction(String id) {
        return mutate("delete transaction", state -> {
            Optional<Transaction> found = state.getTransactions().stream()
                    .filter(t -> t.getId().equals(id))
                    .findFirst();
            if (found.isEmpty()) {
                return false;
            }
            Transaction transaction = found.get();
            long amount = transaction.getAmount() == null ? 0L : transaction.getAmount();

            state.findAccountByName(transaction.getAccount()).ifPresent(a -> {
                a.setBalance(state.balanceOf(a) - amount);
                state.markDirty(LedgerCollection.ACCOUNTS);
            });

            state.getTransactions().remove(transaction);
            state.markDirty(LedgerCollection.TRANSACTIONS);
            return true;
        });
    }

    public List<Account> listAccounts() {
        return read(state -> state.copyAll(LedgerCollection.ACCOUNTS));
    }

    public List<Transaction> listTransactions() {
        return read(state -> state.copyAll(LedgerCollection.TRANSACTIONS));
    }

    public List<FixedCostTemplate> listTemplates() {
        return read(state -> state.copyAll(LedgerCollection.FIXED_COSTS));
    }

    /**
     * Run {@code mutation} against a working copy and commit it once every touched
     * collection is persisted. A mutation that touches nothing commits nothing.
     *
     * @throws ValidationException  if the mutation rejects its input
     * @throws PersistenceException if a collection could not be saved
     */
    public <R> R mutate(String operation, Function<LedgerState, R> mutation) {
        lock.writeLock().lock();
        try {
            LedgerState working = committed.copy();
            R result = mutation.apply(working);
            if (!working.isDirty()) {
                logger.debug("{}: nothing changed", operation);
                return result;
            }
            if (working.isDirty(LedgerCollection.TRANSACTIONS)) {
                TransactionOrdering.sort(working.getTransactions());
            }
            persist(working);
            committed = working;
            logger.info("Committed {}: {}", operation, working.dirtyCollections());
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Run a read-only query against the committed state. Queries must not modify it.
     */
    public <R> R read(Function<LedgerState, R> query) {
        lock.readLock().lock();
        try {
            return query.apply(committed);
        } finally {
            lock.readLock().unlock();
        }
    }

    private void persist(LedgerState working) {
        List<LedgerCollection<?>> saved = new ArrayList<>();
        try {
            for (LedgerCollection<?> collection : working.dirtyCollections()) {
                saveCollection(repository, working, collection);
                saved.add(collection);
            }
        } catch (PersistenceException e) {
            restore(saved, e);
            throw e;
        }
    }

    private void restore(List<LedgerCollection<?>> saved, PersistenceException failure) {
        for (LedgerCollection<?> collection : saved) {
            try {
                saveCollection(repository, committed, collection);
                logger.warn("Restored {} to last committed contents after failed save", collection);
            } catch (PersistenceException e) {
                logger.error("Could not restore {}; stored data is ahead of the in-memory ledger", collection, e);
                failure.addSuppressed(e);
            }
        }
    }

    private static <T> void saveCollection(LedgerRepository repository, LedgerState state, LedgerCollection<T> collection) {
        repository.save(collection, state.records(collection));
    }
}
