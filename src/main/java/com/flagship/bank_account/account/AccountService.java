package com.flagship.bank_account.account;

import com.flagship.bank_account.observability.AccountMetrics;
import com.flagship.bank_account.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.function.Supplier;

/**
 * Use-case layer for account balances.
 *
 * Every mutation is a single read-modify-write delegated to
 * {@link AccountStore#updateBalance}, with the arithmetic and validation left
 * to {@link Account}. Nothing is written when an operation fails.
 *
 * All outcomes come back as an {@link AccountResult}. Storage errors are
 * reported as STORAGE_FAILURE with a generic message; the cause is logged
 * here and never handed to callers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    static final String STORAGE_FAILURE_MESSAGE = "Account storage is currently unavailable";

    private final AccountStore accountStore;
    private final AccountMetrics accountMetrics;

    /**
     * Opens a new account.
     *
     * @param id Account id, must not be blank or longer than {@link Account#MAX_ID_LENGTH}
     * @param initialBalance Starting balance, null means zero
     * @return The new account, or INVALID_ACCOUNT_ID / INVALID_AMOUNT / ACCOUNT_ALREADY_EXISTS
     */
    public AccountResult openAccount(String id, BigDecimal initialBalance) {
        return execute("open", id, () -> {
            if (!Account.isValidId(id)) {
                return AccountResult.failure(AccountError.INVALID_ACCOUNT_ID,
                    "Account id is required and must be at most " + Account.MAX_ID_LENGTH + " characters");
            }
            BigDecimal balance = initialBalance != null ? initialBalance : BigDecimal.ZERO;
            if (balance.compareTo(BigDecimal.ZERO) < 0) {
                return AccountResult.failure(AccountError.INVALID_AMOUNT,
                    "Initial balance must be zero or positive");
            }
            if (!Account.hasSupportedScale(balance) || balance.compareTo(Account.MAX_BALANCE) > 0) {
                return AccountResult.failure(AccountError.INVALID_AMOUNT,
                    "Initial balance must have at most " + Account.MAX_SCALE
                        + " decimal places and not exceed " + Account.MAX_BALANCE);
            }

            Account account = Account.of(id, balance);
            if (!accountStore.createIfAbsent(account)) {
                return AccountResult.failure(AccountError.ACCOUNT_ALREADY_EXISTS,
                    "Account already exists: " + id);
            }
            return AccountResult.success(account);
        });
    }

    /**
     * Deposits funds into an account.
     *
     * @return The updated account, or ACCOUNT_NOT_FOUND / INVALID_AMOUNT
     */
    public AccountResult deposit(String id, BigDecimal amount) {
        return execute("deposit", id,
            () -> accountStore.updateBalance(id, account -> account.deposit(amount)));
    }

    /**
     * Withdraws funds from an account.
     *
     * @return The updated account, or ACCOUNT_NOT_FOUND / INVALID_AMOUNT / INSUFFICIENT_FUNDS
     */
    public AccountResult withdraw(String id, BigDecimal amount) {
        return execute("withdraw", id,
            () -> accountStore.updateBalance(id, account -> account.withdraw(amount)));
    }

    /**
     * Looks up the current balance.
     *
     * @return A snapshot of the account, or ACCOUNT_NOT_FOUND
     */
    public AccountResult balance(String id) {
        return execute("balance", id, () -> accountStore.fetch(id));
    }

    private AccountResult execute(String operation, String id, Supplier<AccountResult> action) {
        long startTime = System.currentTimeMillis();
        if (id != null) {
            MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, id);
        }

        try {
            AccountResult result;
            try {
                result = action.get();
            } catch (DataAccessException e) {
                log.error("Account {} failed in storage", operation, e);
                result = AccountResult.failure(AccountError.STORAGE_FAILURE, STORAGE_FAILURE_MESSAGE);
            }

            long duration = System.currentTimeMillis() - startTime;
            accountMetrics.recordLatency(operation, duration);

            if (result.isSuccess()) {
                accountMetrics.recordOperation(operation, "success");
                log.info("Account {} succeeded: balance={}, duration={}ms",
                    operation, result.getAccount().getBalance(), duration);
            } else {
                accountMetrics.recordOperation(operation, result.getError().name());
                if (result.getError().isRequestError()) {
                    log.info("Account {} rejected: error={}, message={}",
                        operation, result.getError(), result.getMessage());
                }
            }
            return result;
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }
}
