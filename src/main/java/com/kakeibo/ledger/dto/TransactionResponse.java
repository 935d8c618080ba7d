package com.kakeibo.ledger.dto;

import com.kakeibo.ledger.domain.Transaction;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransactionResponse {

    private String id;
    private String date;
    private String account;
    private long amount;
    private String memo;

    public static TransactionResponse from(Transaction transaction) {
        return new TransactionResponse(
                transaction.getId(),
                transaction.getDate(),
                transaction.getAccount(),
                transaction.getAmount() == null ? 0L : transaction.getAmount(),
                transaction.getMemo()
        );
    }
}
