package com.kakeibo.ledger.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

/**
 * A bank account whose balance is kept equal to its opening balance plus the
 * amounts of every transaction referencing it by name.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class Account {

    private String id;
    private String name;
    private Long balance;

    public Account copy() {
        return toBuilder().build();
    }
}
