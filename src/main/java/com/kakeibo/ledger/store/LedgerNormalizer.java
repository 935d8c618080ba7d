package com.kakeibo.ledger.store;

import com.kakeibo.ledger.domain.Account;
import com.kakeibo.ledger.domain.FixedCostTemplate;
import com.kakeibo.ledger.domain.Transaction;
import com.kakeibo.ledger.id.IdGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Backfills ids and defaults on records loaded from older documents.
 *
 * Records are fixed in place. A {@code true} result means at least one field was
 * defaulted and the collections must be written back before anything references
 * the new ids.
 */
@Slf4j
@Component
public class LedgerNormalizer {

    static final String PLACEHOLDER_ACCOUNT_NAME = "(名称未設定)";

    private final IdGenerator idGenerator;
    private final Clock clock;

    public LedgerNormalizer(IdGenerator idGenerator, Clock clock) {
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    public boolean normalize(List<Account> accounts,
                             List<Transaction> transactions,
                             List<FixedCostTemplate> templates) {
        boolean changed = false;
        for (Account account : accounts) {
            changed |= normalizeAccount(account);
        }

        String today = LocalDate.now(clock).toString();
        for (Transaction transaction : transactions) {
            changed |= normalizeTransaction(transaction, today);
        }

        for (FixedCostTemplate template : templates) {
            changed |= normalizeTemplate(template);
        }

        if (changed) {
            log.info("Normalized legacy ledger records: {} accounts, {} transactions, {} fixed costs scanned",
                    accounts.size(), transactions.size(), templates.size());
        }
        return changed;
    }

    private boolean normalizeAccount(Account account) {
        boolean changed = false;
        if (isBlank(account.getId())) {
            account.setId(idGenerator.newId(IdGenerator.ACCOUNT));
            changed = true;
        }
        if (account.getBalance() == null) {
            warnDefaulted("account", account.getId(), "balance");
            account.setBalance(0L);
            changed = true;
        }
        if (account.getName() == null) {
            warnDefaulted("account", account.getId(), "name");
            account.setName(PLACEHOLDER_ACCOUNT_NAME);
            changed = true;
        }
        return changed;
    }

    private boolean normalizeTransaction(Transaction transaction, String today) {
        boolean changed = false;
        if (isBlank(transaction.getId())) {
            transaction.setId(idGenerator.newId(IdGenerator.TRANSACTION));
            changed = true;
        }
        if (transaction.getDate() == null) {
            warnDefaulted("transaction", transaction.getId(), "date");
            transaction.setDate(today);
            changed = true;
        } else if (TransactionOrdering.parseDate(transaction.getDate()).isEmpty()) {
            // kept as-is; ordering puts it last
            log.warn("Transaction {} has unparsable date '{}'", transaction.getId(), transaction.getDate());
        }
        if (transaction.getAccount() == null) {
            warnDefaulted("transaction", transaction.getId(), "account");
            transaction.setAccount("");
            changed = true;
        }
        if (transaction.getAmount() == null) {
            warnDefaulted("transaction", transaction.getId(), "amount");
            transaction.setAmount(0L);
            changed = true;
        }
        if (transaction.getMemo() == null) {
            transaction.setMemo("");
            changed = true;
        }
        return changed;
    }

    private boolean normalizeTemplate(FixedCostTemplate template) {
        boolean changed = false;
        if (isBlank(template.getId())) {
            template.setId(idGenerator.newId(IdGenerator.FIXED_COST));
            changed = true;
        }
        if (template.getDay() == null) {
            template.setDay(FixedCostTemplate.MIN_DAY);
            changed = true;
        } else if (template.getDay() < FixedCostTemplate.MIN_DAY || template.getDay() > FixedCostTemplate.MAX_DAY) {
            int clamped = Math.max(FixedCostTemplate.MIN_DAY, Math.min(FixedCostTemplate.MAX_DAY, template.getDay()));
            log.warn("Fixed cost {} has day {} outside 1-31, clamped to {}", template.getId(), template.getDay(), clamped);
            template.setDay(clamped);
            changed = true;
        }
        if (template.getMemo() == null) {
            template.setMemo("");
            changed = true;
        }
        if (template.getName() == null) {
            warnDefaulted("fixed cost", template.getId(), "name");
            template.setName("");
            changed = true;
        }
        if (template.getAccount() == null) {
            warnDefaulted("fixed cost", template.getId(), "account");
            template.setAccount("");
            changed = true;
        }
        if (template.getAmount() == null) {
            warnDefaulted("fixed cost", template.getId(), "amount");
            template.setAmount(0L);
            changed = true;
        }
        return changed;
    }

    private static void warnDefaulted(String kind, String id, String field) {
        log.warn("Malformed {} record {}: missing {}, defaulted", kind, id, field);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
