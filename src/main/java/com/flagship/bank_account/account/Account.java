package com.flagship.bank_account.account;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Domain model for a bank Account.
 *
 * Key invariants:
 * - Balance is never negative
 * - Deposits must be strictly positive
 * - Withdrawals must be positive and cannot exceed the balance
 *
 * Ids and amounts are bounded by what the accounts table stores exactly
 * (VARCHAR(64), NUMERIC(19,4)); anything outside those bounds is rejected
 * rather than truncated or rounded.
 *
 * Accounts are immutable: deposit and withdraw return a result holding a new
 * Account, so a rejected operation can never leave a partial update behind.
 */
@Value
public class Account {

    /** Longest id the accounts table holds. */
    public static final int MAX_ID_LENGTH = 64;

    /** Decimal places kept for balances and amounts. */
    public static final int MAX_SCALE = 4;

    /** Largest balance that fits NUMERIC(19,4). */
    public static final BigDecimal MAX_BALANCE = new BigDecimal("999999999999999.9999");

    String id;
    BigDecimal balance;

    private Account(String id, BigDecimal balance) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Account id is required");
        }
        if (id.length() > MAX_ID_LENGTH) {
            throw new IllegalArgumentException(
                "Account id must be at most " + MAX_ID_LENGTH + " characters");
        }
        if (balance == null || balance.compareTo(BigDecimal.ZERO) < 0) {
            throw new IllegalArgumentException("Balance must be zero or positive");
        }
        if (!hasSupportedScale(balance) || balance.compareTo(MAX_BALANCE) > 0) {
            throw new IllegalArgumentException("Balance cannot be stored exactly: " + balance);
        }
        this.id = id;
        this.balance = balance;
    }

    /**
     * Creates a new account with a zero balance.
     */
    public static Account open(String id) {
        return new Account(id, BigDecimal.ZERO);
    }

    public static Account of(String id, BigDecimal balance) {
        return new Account(id, balance);
    }

    static boolean isValidId(String id) {
        return id != null && !id.isBlank() && id.length() <= MAX_ID_LENGTH;
    }

    static boolean hasSupportedScale(BigDecimal amount) {
        return amount.stripTrailingZeros().scale() <= MAX_SCALE;
    }

    /**
     * Deposits funds into the account.
     *
     * @param amount Amount to deposit, must be greater than zero with at most four decimal places
     * @return Success with the new Account, or INVALID_AMOUNT
     */
    public AccountResult deposit(BigDecimal amount) {
        if (amount == null || amount.compareTo(BigDecimal.ZERO) <= 0) {
            return AccountResult.failure(AccountError.INVALID_AMOUNT,
                "Deposit amount must be greater than 0");
        }
        if (!hasSupportedScale(amount)) {
            return tooPrecise(amount);
        }
        BigDecimal newBalance = this.balance.add(amount);
        if (newBalance.compareTo(MAX_BALANCE) > 0) {
            return AccountResult.failure(AccountError.INVALID_AMOUNT,
                String.format("Deposit of %s would raise the balance of account %s above %s",
                    amount, this.id, MAX_BALANCE));
        }
        return AccountResult.success(new Account(this.id, newBalance));
    }

    /**
     * Withdraws funds from the account.
     *
     * @param amount Amount to withdraw, must be greater than zero and not exceed the balance
     * @return Success with the new Account, or INVALID_AMOUNT / INSUFFICIENT_FUNDS
     */
    public AccountResult withdraw(BigDecimal amount) {
        if (amount == null || amount.compareTo(BigDecimal.ZERO) <= 0) {
            return AccountResult.failure(AccountError.INVALID_AMOUNT,
                "Withdrawal amount must be greater than 0");
        }
        if (!hasSupportedScale(amount)) {
            return tooPrecise(amount);
        }
        if (amount.compareTo(this.balance) > 0) {
            return AccountResult.failure(AccountError.INSUFFICIENT_FUNDS,
                String.format("Insufficient funds in account %s: balance=%s, requested=%s",
                    this.id, this.balance, amount));
        }
        return AccountResult.success(new Account(this.id, this.balance.subtract(amount)));
    }

    private static AccountResult tooPrecise(BigDecimal amount) {
        return AccountResult.failure(AccountError.INVALID_AMOUNT,
            "Amount " + amount.toPlainString() + " has more than " + MAX_SCALE + " decimal places");
    }
}
