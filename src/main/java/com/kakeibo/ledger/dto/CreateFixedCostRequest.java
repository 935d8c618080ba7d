package com.kakeibo.ledger.dto;

import jakarta.validation.constraints.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateFixedCostRequest {

    @NotBlank(message = "Fixed cost name is required")
    @Size(max = 100, message = "Fixed cost name must not exceed 100 characters")
    private String name;

    @NotBlank(message = "Account is required")
    private String account;

    @NotNull(message = "Amount is required")
    private Long amount;

    @Size(max = 500, message = "Memo must not exceed 500 characters")
    private String memo;

    @NotNull(message = "Day is required")
    @Min(value = 1, message = "Day must be between 1 and 31")
    @Max(value = 31, message = "Day must be between 1 and 31")
    private Integer day;
}
