package com.kakeibo.ledger.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

/**
 * A single income (positive amount) or expense (negative amount).
 *
 * The account is referenced by name, not id. The date is kept as the raw ISO string
 * because legacy documents may carry values that do not parse.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class Transaction {

    private String id;
    private String date;
    private String account;
    private Long amount;
    private String memo;

    public Transaction copy() {
        return toBuilder().build();
    }
}
