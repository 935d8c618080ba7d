package com.kakeibo.ledger.dto;

import com.kakeibo.ledger.domain.Account;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccountResponse {
    private String id;
    private String name;
    private long balance;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
                .id(account.getId())
                .name(account.getName())
                .balance(account.getBalance() == null ? 0L : account.getBalance())
                .build();
    }
}
