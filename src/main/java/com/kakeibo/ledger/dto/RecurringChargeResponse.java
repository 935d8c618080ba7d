package com.kakeibo.ledger.dto;

import com.kakeibo.ledger.service.RecurringChargeResult;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecurringChargeResponse {
    private String date;
    private int added;
    private int skippedFuture;
    private int skippedDuplicate;
    private int skippedNoAccount;

    public static RecurringChargeResponse from(String date, RecurringChargeResult result) {
        return RecurringChargeResponse.builder()
                .date(date)
                .added(result.getAdded())
                .skippedFuture(result.getSkippedFuture())
                .skippedDuplicate(result.getSkippedDuplicate())
                .skippedNoAccount(result.getSkippedNoAccount())
                .build();
    }
}
