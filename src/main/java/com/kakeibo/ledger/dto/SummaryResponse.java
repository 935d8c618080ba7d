package com.kakeibo.ledger.dto;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SummaryResponse {
    private String period;
    private long totalBalance;
    private long income;
    private long expense;
}
