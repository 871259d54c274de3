package com.flagship.bank_account.account;

import java.math.BigDecimal;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Non-durable account store holding balances in a ConcurrentHashMap.
 *
 * updateBalance() runs inside {@link ConcurrentMap#computeIfPresent}, which is atomic per key.
 */
public class InMemoryAccountStore implements AccountStore {

    private final ConcurrentMap<String, BigDecimal> balances = new ConcurrentHashMap<>();

    @Override
    public AccountResult fetch(String id) {
        BigDecimal balance = id == null ? null : balances.get(id);
        if (balance == null) {
            return AccountResult.failure(AccountError.ACCOUNT_NOT_FOUND, "Account not found: " + id);
        }
        return AccountResult.success(Account.of(id, balance));
    }

    @Override
    public void save(Account account) {
        balances.put(account.getId(), account.getBalance());
    }

    @Override
    public boolean createIfAbsent(Account account) {
        return balances.putIfAbsent(account.getId(), account.getBalance()) == null;
    }

    @Override
    public AccountResult updateBalance(String id, Function<Account, AccountResult> mutation) {
        if (id == null) {
            return fetch(null);
        }
        AccountResult[] outcome = new AccountResult[1];
        balances.computeIfPresent(id, (key, current) -> {
            AccountResult result = mutation.apply(Account.of(key, current));
            if (result.isSuccess() && !key.equals(result.getAccount().getId())) {
                throw new IllegalStateException(
                    String.format("Mutation of account %s returned account %s", key, result.getAccount().getId()));
            }
            outcome[0] = result;
            return result.isSuccess() ? result.getAccount().getBalance() : current;
        });
        if (outcome[0] == null) {
            return AccountResult.failure(AccountError.ACCOUNT_NOT_FOUND, "Account not found: " + id);
        }
        return outcome[0];
    }
}
