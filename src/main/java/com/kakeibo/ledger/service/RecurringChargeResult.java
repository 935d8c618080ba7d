package com.kakeibo.ledger.service;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome counts of one fixed-cost batch run.
 */
@Getter
@AllArgsConstructor
@ToString
public class RecurringChargeResult {

    private final int added;
    private final int skippedFuture;
    private final int skippedDuplicate;
    private final int skippedNoAccount;
}
