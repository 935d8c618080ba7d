package com.kakeibo.ledger.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

/**
 * Monthly recurring charge or credit. Holds no balance state of its own; it only
 * describes the transaction generated once per month on or after {@code day}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class FixedCostTemplate {

    public static final int MIN_DAY = 1;
    public static final int MAX_DAY = 31;

    private String id;
    private String name;
    private String account;
    private Long amount;
    private String memo;
    private Integer day;

    public FixedCostTemplate copy() {
        return toBuilder().build();
    }
}
