package com.flagship.bank_account.account.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request DTO for deposits and withdrawals.
 *
 * Only presence is checked here; positivity and funds are domain rules.
 */
@Value
public class AmountRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonCreator
    public AmountRequest(@JsonProperty("amount") BigDecimal amount) {
        this.amount = amount;
    }
}
