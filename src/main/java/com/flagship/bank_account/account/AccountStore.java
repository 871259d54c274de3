package com.flagship.bank_account.account;

import java.util.function.Function;

/**
 * Persistence port for account balances.
 *
 * The store exclusively owns durable state. Accounts handed out by
 * {@link #fetch(String)} are detached snapshots.
 */
public interface AccountStore {

    /**
     * Loads an account.
     *
     * @param id Account id
     * @return Success with a snapshot of the account, or ACCOUNT_NOT_FOUND
     */
    AccountResult fetch(String id);

    /**
     * Inserts or replaces the record for {@code account.getId()}.
     * Atomic with respect to other reads and writes of the same id.
     */
    void save(Account account);

    /**
     * Inserts the account only if no record exists for its id.
     *
     * @return true if a record was created, false if the id was already taken
     */
    boolean createIfAbsent(Account account);

    /**
     * Atomically reads, mutates and writes back one account.
     *
     * Concurrent calls for the same id are serialized, so no update is lost.
     * When the mutation returns a failure nothing is written.
     *
     * @param id Account id
     * @param mutation Maps the current account to the new one (or a failure)
     * @return The mutation's result, or ACCOUNT_NOT_FOUND
     */
    AccountResult updateBalance(String id, Function<Account, AccountResult> mutation);
}
