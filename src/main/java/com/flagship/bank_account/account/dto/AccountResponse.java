package com.flagship.bank_account.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bank_account.account.Account;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Response DTO carrying an account's current balance.
 */
@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("balance")
    BigDecimal balance;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .balance(account.getBalance())
            .build();
    }
}
