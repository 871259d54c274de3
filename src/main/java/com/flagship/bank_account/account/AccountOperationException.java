package com.flagship.bank_account.account;

import lombok.Getter;

/**
 * Thrown when a failed {@link AccountResult} is unwrapped with {@link AccountResult#orElseThrow()}.
 */
@Getter
public class AccountOperationException extends RuntimeException {

    private final AccountError error;

    public AccountOperationException(AccountError error, String message) {
        super(message);
        this.error = error;
    }
}
