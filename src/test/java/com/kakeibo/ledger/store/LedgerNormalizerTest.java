package com.kakeibo.ledger.store;

import com.kakeibo.ledger.domain.Account;
import com.kakeibo.ledger.domain.FixedCostTemplate;
import com.kakeibo.ledger.domain.Transaction;
import com.kakeibo.ledger.id.IdGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class LedgerNormalizerTest {

    private LedgerNormalizer normalizer;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-15T03:00:00Z"), ZoneOffset.UTC);
        normalizer = new LedgerNormalizer(new IdGenerator(), clock);
    }

    @Test
    void testNormalize_LegacyRecords_BackfillsIdsAndDefaults() {
        // Given - records as written before ids existed
        Account account = new Account(null, null, null);
        Transaction transaction = new Transaction(null, null, null, null, null);
        FixedCostTemplate template = new FixedCostTemplate(null, "奨学金", "SMBC", -15000L, null, null);

        // When
        boolean changed = normalizer.normalize(
                new ArrayList<>(List.of(account)),
                new ArrayList<>(List.of(transaction)),
                new ArrayList<>(List.of(template)));

        // Then
        assertThat(changed).isTrue();

        assertThat(account.getId()).startsWith("acc_");
        assertThat(account.getName()).isEqualTo(LedgerNormalizer.PLACEHOLDER_ACCOUNT_NAME);
        assertThat(account.getBalance()).isZero();

        assertThat(transaction.getId()).startsWith("tx_");
        assertThat(transaction.getDate()).isEqualTo("2024-05-15");
        assertThat(transaction.getAccount()).isEmpty();
        assertThat(transaction.getAmount()).isZero();
        assertThat(transaction.getMemo()).isEmpty();

        assertThat(template.getId()).startsWith("fc_");
        assertThat(template.getDay()).isEqualTo(1);
        assertThat(template.getMemo()).isEmpty();
        assertThat(template.getName()).isEqualTo("奨学金");
    }

    @Test
    void testNormalize_CompleteRecords_ReportsNoChange() {
        // Given
        List<Account> accounts = new ArrayList<>(List.of(new Account("acc_1", "SMBC", 1000L)));
        List<Transaction> transactions = new ArrayList<>(List.of(
                new Transaction("tx_1", "2024-05-01", "SMBC", 1000L, "")));
        List<FixedCostTemplate> templates = new ArrayList<>(List.of(
                new FixedCostTemplate("fc_1", "NURO光", "SMBC", -5000L, "", 25)));

        // When
        boolean changed = normalizer.normalize(accounts, transactions, templates);

        // Then
        assertThat(changed).isFalse();
        assertThat(accounts.get(0).getId()).isEqualTo("acc_1");
    }

    @Test
    void testNormalize_UnparsableDate_KeptAsIsWithoutChange() {
        // Given
        Transaction transaction = new Transaction("tx_1", "2024-99-99", "SMBC", 100L, "");

        // When
        boolean changed = normalizer.normalize(new ArrayList<>(), new ArrayList<>(List.of(transaction)), new ArrayList<>());

        // Then
        assertThat(changed).isFalse();
        assertThat(transaction.getDate()).isEqualTo("2024-99-99");
    }

    @Test
    void testNormalize_BlankIdAndOutOfRangeDay_AreFixed() {
        // Given
        FixedCostTemplate template = new FixedCostTemplate(" ", "Paidy", "SMBC", -3000L, "", 40);

        // When
        boolean changed = normalizer.normalize(new ArrayList<>(), new ArrayList<>(), new ArrayList<>(List.of(template)));

        // Then
        assertThat(changed).isTrue();
        assertThat(template.getId()).startsWith("fc_");
        assertThat(template.getDay()).isEqualTo(31);
    }
}
