package com.flagship.bank_account.account;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Objects;

/**
 * Outcome of an account operation: either an Account or an error kind with a message.
 *
 * Validation failures are returned, not thrown; callers branch on {@link #isSuccess()}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountResult {
    Account account;
    AccountError error;
    String message;

    public static AccountResult success(Account account) {
        return new AccountResult(Objects.requireNonNull(account), null, null);
    }

    public static AccountResult failure(AccountError error, String message) {
        return new AccountResult(null, Objects.requireNonNull(error), message);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Returns the account, or throws if this result is a failure.
     *
     * @throws AccountOperationException carrying the error kind and message
     */
    public Account orElseThrow() {
        if (!isSuccess()) {
            throw new AccountOperationException(error, message);
        }
        return account;
    }
}
