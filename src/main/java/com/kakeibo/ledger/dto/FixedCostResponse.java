package com.kakeibo.ledger.dto;

import com.kakeibo.ledger.domain.FixedCostTemplate;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FixedCostResponse {

    private String id;
    private String name;
    private String account;
    private long amount;
    private String memo;
    private int day;

    public static FixedCostResponse from(FixedCostTemplate template) {
        return new FixedCostResponse(
                template.getId(),
                template.getName(),
                template.getAccount(),
                template.getAmount() == null ? 0L : template.getAmount(),
                template.getMemo(),
                template.getDay() == null ? FixedCostTemplate.MIN_DAY : template.getDay()
        );
    }
}
