package com.kakeibo.ledger.store;

import com.kakeibo.ledger.domain.Account;
import com.kakeibo.ledger.domain.FixedCostTemplate;
import com.kakeibo.ledger.domain.Transaction;

import java.util.List;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Key of one of the three persisted record collections.
 *
 * @param <T> record type stored in the collection
 */
public final class LedgerCollection<T> {

    public static final LedgerCollection<Account> ACCOUNTS =
            new LedgerCollection<>("accounts", Account.class, Account::copy, LedgerState::getAccounts);
    public static final LedgerCollection<Transaction> TRANSACTIONS =
            new LedgerCollection<>("transactions", Transaction.class, Transaction::copy, LedgerState::getTransactions);
    public static final LedgerCollection<FixedCostTemplate> FIXED_COSTS =
            new LedgerCollection<>("fixed_costs", FixedCostTemplate.class, FixedCostTemplate::copy, LedgerState::getTemplates);

    public static final List<LedgerCollection<?>> ALL = List.of(ACCOUNTS, TRANSACTIONS, FIXED_COSTS);

    private final String key;
    private final Class<T> recordType;
    private final UnaryOperator<T> copier;
    private final Function<LedgerState, List<T>> accessor;

    private LedgerCollection(String key, Class<T> recordType, UnaryOperator<T> copier,
                             Function<LedgerState, List<T>> accessor) {
        this.key = key;
        this.recordType = recordType;
        this.copier = copier;
        this.accessor = accessor;
    }

    public String getKey() {
        return key;
    }

    public String getFileName() {
        return key + ".json";
    }

    public Class<T> getRecordType() {
        return recordType;
    }

    public T copy(T record) {
        return copier.apply(record);
    }

    public List<T> recordsOf(LedgerState state) {
        return accessor.apply(state);
    }

    @Override
    public String toString() {
        return key;
    }
}
