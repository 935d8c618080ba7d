package com.kakeibo.ledger.service;

import com.kakeibo.ledger.domain.Account;
import com.kakeibo.ledger.domain.FixedCostTemplate;
import com.kakeibo.ledger.domain.Transaction;
import com.kakeibo.ledger.id.IdGenerator;
import com.kakeibo.ledger.store.InMemoryLedgerRepository;
import com.kakeibo.ledger.store.LedgerCollection;
import com.kakeibo.ledger.store.LedgerNormalizer;
import com.kakeibo.ledger.store.LedgerStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RecurringChargeServiceTest {

    private InMemoryLedgerRepository repository;
    private LedgerStore ledgerStore;
    private SimpleMeterRegistry meterRegistry;
    private RecurringChargeService recurringChargeService;

    @BeforeEach
    void setUp() {
        repository = new InMemoryLedgerRepository();
        IdGenerator idGenerator = new IdGenerator();
        LedgerNormalizer normalizer = new LedgerNormalizer(idGenerator,
                Clock.fixed(Instant.parse("2024-05-01T00:00:00Z"), ZoneOffset.UTC));
        ledgerStore = LedgerStore.open(repository, normalizer, idGenerator);
        meterRegistry = new SimpleMeterRegistry();
        recurringChargeService = new RecurringChargeService(ledgerStore, idGenerator, meterRegistry);
    }

    private long balanceOf(String name) {
        return ledgerStore.listAccounts().stream()
                .filter(a -> a.getName().equals(name))
                .findFirst()
                .orElseThrow()
                .getBalance();
    }

    @Test
    void testApplyFixedCosts_NotYetDue_SkippedFuture() {
        // Given
        ledgerStore.addAccount("SMBC", 100_000);
        ledgerStore.addTemplate("奨学金", "SMBC", -15_000, "", 28);

        // When
        RecurringChargeResult result = recurringChargeService.applyFixedCosts(LocalDate.of(2024, 5, 27));

        // Then
        assertThat(result.getSkippedFuture()).isEqualTo(1);
        assertThat(result.getAdded()).isZero();
        assertThat(ledgerStore.listTransactions()).isEmpty();
        assertThat(balanceOf("SMBC")).isEqualTo(100_000L);
    }

    @Test
    void testApplyFixedCosts_DueToday_AddsTransactionAndAdjustsBalance() {
        // Given
        ledgerStore.addAccount("SMBC", 100_000);
        ledgerStore.addTemplate("奨学金", "SMBC", -15_000, "", 28);

        // When
        RecurringChargeResult result = recurringChargeService.applyFixedCosts(LocalDate.of(2024, 5, 28));

        // Then
        assertThat(result.getAdded()).isEqualTo(1);
        List<Transaction> transactions = ledgerStore.listTransactions();
        assertThat(transactions).hasSize(1);
        Transaction generated = transactions.get(0);
        assertThat(generated.getDate()).isEqualTo("2024-05-28");
        assertThat(generated.getAccount()).isEqualTo("SMBC");
        assertThat(generated.getAmount()).isEqualTo(-15_000L);
        assertThat(generated.getMemo()).isEqualTo("固定費:奨学金");
        assertThat(balanceOf("SMBC")).isEqualTo(85_000L);

        assertThat(repository.load(LedgerCollection.TRANSACTIONS)).hasSize(1);
        assertThat(repository.load(LedgerCollection.ACCOUNTS).get(0).getBalance()).isEqualTo(85_000L);
    }

    @Test
    void testApplyFixedCosts_DayPassedEarlierInMonth_UsesTemplateDayAsDate() {
        // Given
        ledgerStore.addAccount("SMBC", 0);
        ledgerStore.addTemplate("NURO光", "SMBC", -5_000, "ネット", 5);

        // When
        recurringChargeService.applyFixedCosts(LocalDate.of(2024, 6, 19));

        // Then
        Transaction generated = ledgerStore.listTransactions().get(0);
        assertThat(generated.getDate()).isEqualTo("2024-06-05");
        assertThat(generated.getMemo()).isEqualTo("固定費:NURO光 / ネット");
    }

    @Test
    void testApplyFixedCosts_SecondRunSameDate_AddsNothing() {
        // Given
        ledgerStore.addAccount("SMBC", 50_000);
        ledgerStore.addAccount("SBI", 0);
        ledgerStore.addTemplate("Paidy", "SMBC", -3_000, "", 1);
        ledgerStore.addTemplate("給与", "SBI", 200_000, "", 25);
        LocalDate today = LocalDate.of(2024, 5, 25);
        recurringChargeService.applyFixedCosts(today);
        List<Transaction> afterFirst = ledgerStore.listTransactions();

        // When
        RecurringChargeResult second = recurringChargeService.applyFixedCosts(today);

        // Then
        assertThat(second.getAdded()).isZero();
        assertThat(second.getSkippedDuplicate()).isEqualTo(2);
        assertThat(ledgerStore.listTransactions())
                .usingRecursiveFieldByFieldElementComparator()
                .containsExactlyElementsOf(afterFirst);
        assertThat(balanceOf("SMBC")).isEqualTo(47_000L);
        assertThat(balanceOf("SBI")).isEqualTo(200_000L);
    }

    @Test
    void testApplyFixedCosts_ManualTransactionWithSameValues_CountsAsDuplicate() {
        // Given - the charge was already entered by hand, with stray whitespace
        ledgerStore.addAccount("SMBC", 0);
        ledgerStore.addTemplate("Paidy", "SMBC", -3_000, "", 10);
        ledgerStore.addTransaction(LocalDate.of(2024, 5, 10), " SMBC ", -3_000, "固定費:Paidy");

        // When
        RecurringChargeResult result = recurringChargeService.applyFixedCosts(LocalDate.of(2024, 5, 12));

        // Then
        assertThat(result.getSkippedDuplicate()).isEqualTo(1);
        assertThat(ledgerStore.listTransactions()).hasSize(1);
    }

    @Test
    void testApplyFixedCosts_TwoTemplatesSameTuple_OnlyFirstAdded() {
        // Given
        ledgerStore.addAccount("SMBC", 0);
        ledgerStore.addTemplate("Paidy", "SMBC", -3_000, "", 10);
        ledgerStore.addTemplate("Paidy", "SMBC", -3_000, "", 10);

        // When
        RecurringChargeResult result = recurringChargeService.applyFixedCosts(LocalDate.of(2024, 5, 10));

        // Then
        assertThat(result.getAdded()).isEqualTo(1);
        assertThat(result.getSkippedDuplicate()).isEqualTo(1);
        assertThat(balanceOf("SMBC")).isEqualTo(-3_000L);
    }

    @Test
    void testApplyFixedCosts_AccountMissing_SkippedWithoutSideEffects() {
        // Given - template whose account was deleted afterwards
        Account account = ledgerStore.addAccount("楽天", 1_000);
        ledgerStore.addAccount("SMBC", 500);
        ledgerStore.addTemplate("楽天カード", "楽天", -2_000, "", 3);
        ledgerStore.deleteAccount(account.getId());

        // When
        RecurringChargeResult result = recurringChargeService.applyFixedCosts(LocalDate.of(2024, 5, 3));

        // Then
        assertThat(result.getSkippedNoAccount()).isEqualTo(1);
        assertThat(result.getAdded()).isZero();
        assertThat(ledgerStore.listTransactions()).isEmpty();
        assertThat(balanceOf("SMBC")).isEqualTo(500L);
    }

    @Test
    void testApplyFixedCosts_MixedOutcomes_CountsEachAndRecordsMetrics() {
        // Given
        Account gone = ledgerStore.addAccount("Old", 0);
        ledgerStore.addAccount("SMBC", 0);
        ledgerStore.addTemplate("due", "SMBC", -100, "", 1);
        ledgerStore.addTemplate("later", "SMBC", -100, "", 31);
        ledgerStore.addTemplate("orphan", "Old", -100, "", 1);
        ledgerStore.deleteAccount(gone.getId());
        recurringChargeService.applyFixedCosts(LocalDate.of(2024, 5, 15));

        // When
        RecurringChargeResult result = recurringChargeService.applyFixedCosts(LocalDate.of(2024, 5, 15));

        // Then
        assertThat(result.getAdded()).isZero();
        assertThat(result.getSkippedDuplicate()).isEqualTo(1);
        assertThat(result.getSkippedFuture()).isEqualTo(1);
        assertThat(result.getSkippedNoAccount()).isEqualTo(1);

        assertThat(meterRegistry.get("fixedcost.generated").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("fixedcost.skipped").tag("reason", "future").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("fixedcost.skipped").tag("reason", "duplicate").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("fixedcost.skipped").tag("reason", "no_account").counter().count()).isEqualTo(2.0);
    }

    @Test
    void testComposeMemo_AppendsTemplateMemoWhenPresent() {
        FixedCostTemplate plain = new FixedCostTemplate("fc_1", " 奨学金 ", "SMBC", -1L, "  ", 1);
        FixedCostTemplate withMemo = new FixedCostTemplate("fc_2", "奨学金", "SMBC", -1L, " 固定費 ", 1);

        assertThat(RecurringChargeService.composeMemo(plain)).isEqualTo("固定費:奨学金");
        assertThat(RecurringChargeService.composeMemo(withMemo)).isEqualTo("固定費:奨学金 / 固定費");
    }
}
