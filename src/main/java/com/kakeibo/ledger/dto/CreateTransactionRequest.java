package com.kakeibo.ledger.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateTransactionRequest {

    @NotNull(message = "Date is required")
    private LocalDate date;

    @NotNull(message = "Account is required")
    private String account;

    @NotNull(message = "Amount is required")
    private Long amount;

    @Size(max = 500, message = "Memo must not exceed 500 characters")
    private String memo;
}
