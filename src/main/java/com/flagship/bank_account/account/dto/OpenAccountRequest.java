package com.flagship.bank_account.account.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request DTO for opening an account. A missing initial balance means zero.
 */
@Value
public class OpenAccountRequest {

    @NotBlank(message = "Account id is required")
    @Size(max = 64, message = "Account id must be at most 64 characters")
    @JsonProperty("id")
    String id;

    @JsonProperty("initial_balance")
    BigDecimal initialBalance;

    @JsonCreator
    public OpenAccountRequest(@JsonProperty("id") String id,
                              @JsonProperty("initial_balance") BigDecimal initialBalance) {
        this.id = id;
        this.initialBalance = initialBalance;
    }
}
