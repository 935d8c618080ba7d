package com.kakeibo.ledger.store;

import com.kakeibo.ledger.domain.Transaction;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The one order transactions are stored and listed in: parsed date ascending, with
 * unparsable or missing dates after every valid one, then id ascending.
 */
public final class TransactionOrdering {

    public static final Comparator<Transaction> COMPARATOR =
            Comparator.comparing((Transaction t) -> parseDate(t.getDate()).orElse(null),
                            Comparator.nullsLast(Comparator.<LocalDate>naturalOrder()))
                    .thenComparing(Transaction::getId, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private TransactionOrdering() {
    }

    /**
     * Sort in place. List.sort is stable, so re-sorting a sorted list changes nothing.
     */
    public static void sort(List<Transaction> transactions) {
        transactions.sort(COMPARATOR);
    }

    public static boolean isSorted(List<Transaction> transactions) {
        for (int i = 1; i < transactions.size(); i++) {
            if (COMPARATOR.compare(transactions.get(i - 1), transactions.get(i)) > 0) {
                return false;
            }
        }
        return true;
    }

    public static Optional<LocalDate> parseDate(String date) {
        if (date == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(date));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
