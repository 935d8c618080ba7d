package com.kakeibo.ledger.service;

import com.kakeibo.ledger.domain.Account;
import com.kakeibo.ledger.domain.FixedCostTemplate;
import com.kakeibo.ledger.domain.Transaction;
import com.kakeibo.ledger.id.IdGenerator;
import com.kakeibo.ledger.store.LedgerCollection;
import com.kakeibo.ledger.store.LedgerState;
import com.kakeibo.ledger.store.LedgerStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

@Service
public class RecurringChargeService {

    private static final Logger logger = LoggerFactory.getLogger(RecurringChargeService.class);

    static final String MEMO_PREFIX = "固定費:";
    static final String MEMO_SEPARATOR = " / ";

    private static final DateTimeFormatter MONTH_PREFIX = DateTimeFormatter.ofPattern("yyyy-MM");

    private enum Outcome { ADDED, SKIPPED_FUTURE, SKIPPED_DUPLICATE, SKIPPED_NO_ACCOUNT }

    private final LedgerStore ledgerStore;
    private final IdGenerator idGenerator;
    private final Counter generatedCounter;
    private final Counter skippedFutureCounter;
    private final Counter skippedDuplicateCounter;
    private final Counter skippedNoAccountCounter;

    public RecurringChargeService(LedgerStore ledgerStore, IdGenerator idGenerator, MeterRegistry meterRegistry) {
        this.ledgerStore = ledgerStore;
        this.idGenerator = idGenerator;

        this.generatedCounter = Counter.builder("fixedcost.generated")
                .description("Transactions generated from fixed cost templates")
                .register(meterRegistry);
        this.skippedFutureCounter = skippedCounter(meterRegistry, "future");
        this.skippedDuplicateCounter = skippedCounter(meterRegistry, "duplicate");
        this.skippedNoAccountCounter = skippedCounter(meterRegistry, "no_account");
    }

    private static Counter skippedCounter(MeterRegistry meterRegistry, String reason) {
        return Counter.builder("fixedcost.skipped")
                .description("Fixed cost templates skipped during a batch run")
                .tag("reason", reason)
                .register(meterRegistry);
    }

    /**
     * Generate this month's transaction for every fixed cost that is due on {@code today}.
     *
     * Per template, in list order:
     * - day of month still ahead of today: skipped, never generated early
     * - a transaction with the same date, account, amount and memo already exists: skipped
     * - no account with the template's (trimmed) name: skipped, nothing is recorded
     * - otherwise the transaction is recorded and applied to the account's balance
     *
     * Running it again for the same date adds nothing, since every template then hits
     * the duplicate check. Both accounts and transactions are persisted in one commit.
     */
    public RecurringChargeResult applyFixedCosts(LocalDate today) {
        logger.debug("Applying fixed costs for {}", today);

        RecurringChargeResult result = ledgerStore.mutate("apply fixed costs", state -> {
            String monthPrefix = today.format(MONTH_PREFIX);
            int added = 0;
            int skippedFuture = 0;
            int skippedDuplicate = 0;
            int skippedNoAccount = 0;

            for (FixedCostTemplate template : state.getTemplates()) {
                Outcome outcome = apply(state, template, monthPrefix, today.getDayOfMonth());
                logger.debug("Fixed cost {} ({}): {}", template.getId(), template.getName(), outcome);
                switch (outcome) {
                    case ADDED:
                        added++;
                        break;
                    case SKIPPED_FUTURE:
                        skippedFuture++;
                        break;
                    case SKIPPED_DUPLICATE:
                        skippedDuplicate++;
                        break;
                    default:
                        skippedNoAccount++;
                        break;
                }
            }

            state.markDirty(LedgerCollection.TRANSACTIONS);
            state.markDirty(LedgerCollection.ACCOUNTS);
            return new RecurringChargeResult(added, skippedFuture, skippedDuplicate, skippedNoAccount);
        });

        generatedCounter.increment(result.getAdded());
        skippedFutureCounter.increment(result.getSkippedFuture());
        skippedDuplicateCounter.increment(result.getSkippedDuplicate());
        skippedNoAccountCounter.increment(result.getSkippedNoAccount());

        logger.info("Fixed costs for {}: added={}, skippedFuture={}, skippedDuplicate={}, skippedNoAccount={}",
                today, result.getAdded(), result.getSkippedFuture(),
                result.getSkippedDuplicate(), result.getSkippedNoAccount());
        return result;
    }

    private Outcome apply(LedgerState state, FixedCostTemplate template, String monthPrefix, int todayDay) {
        int day = template.getDay() == null ? FixedCostTemplate.MIN_DAY : template.getDay();
        if (todayDay < day) {
            return Outcome.SKIPPED_FUTURE;
        }

        String date = String.format("%s-%02d", monthPrefix, day);
        String account = trimmed(template.getAccount());
        long amount = template.getAmount() == null ? 0L : template.getAmount();
        String memo = composeMemo(template);

        boolean duplicate = state.getTransactions().stream()
                .anyMatch(t -> date.equals(t.getDate())
                        && account.equals(trimmed(t.getAccount()))
                        && t.getAmount() != null && t.getAmount() == amount
                        && memo.equals(trimmed(t.getMemo())));
        if (duplicate) {
            return Outcome.SKIPPED_DUPLICATE;
        }

        Optional<Account> target = state.findAccountByTrimmedName(account);
        if (target.isEmpty()) {
            return Outcome.SKIPPED_NO_ACCOUNT;
        }

        Account a = target.get();
        a.setBalance(state.balanceOf(a) + amount);
        state.getTransactions().add(new Transaction(
                idGenerator.newId(IdGenerator.TRANSACTION), date, account, amount, memo));
        return Outcome.ADDED;
    }

    static String composeMemo(FixedCostTemplate template) {
        String memo = MEMO_PREFIX + trimmed(template.getName());
        String extra = trimmed(template.getMemo());
        if (!extra.isEmpty()) {
            memo += MEMO_SEPARATOR + extra;
        }
        return memo;
    }

    private static String trimmed(String value) {
        return value == null ? "" : value.strip();
    }
}
