package com.flagship.bank_account.account;

/**
 * Kinds of failure an account operation can report.
 *
 * Request errors (the caller asked for something invalid) are kept apart from
 * STORAGE_FAILURE (the system itself is broken) so adapters can tell them apart.
 */
public enum AccountError {
    /**
     * No account exists for the given id.
     */
    ACCOUNT_NOT_FOUND,

    /**
     * Amount is missing, zero or negative.
     */
    INVALID_AMOUNT,

    /**
     * Withdrawal exceeds the current balance.
     */
    INSUFFICIENT_FUNDS,

    /**
     * Account id is missing or blank.
     */
    INVALID_ACCOUNT_ID,

    /**
     * An account with the given id has already been opened.
     */
    ACCOUNT_ALREADY_EXISTS,

    /**
     * The persistence layer failed (I/O, connection loss, corruption).
     */
    STORAGE_FAILURE;

    public boolean isRequestError() {
        return this != STORAGE_FAILURE;
    }
}
