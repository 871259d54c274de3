package com.flagship.bank_account.account;

import com.flagship.bank_account.observability.AccountMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for AccountService read-modify-write cycles.
 *
 * Runs against the in-memory store; storage failures are simulated with a mocked store.
 */
class AccountServiceTest {

    private InMemoryAccountStore store;
    private SimpleMeterRegistry meterRegistry;
    private AccountService accountService;

    @BeforeEach
    void setUp() {
        store = new InMemoryAccountStore();
        meterRegistry = new SimpleMeterRegistry();
        accountService = new AccountService(store, new AccountMetrics(meterRegistry));
    }

    @Test
    @DisplayName("Deposit, overdraft and full withdrawal against a seeded account")
    void testBalanceScenario() {
        // Given: a fresh store holding account 12345 with 100.0
        store.save(Account.of("12345", new BigDecimal("100.0")));

        // When: depositing 50
        AccountResult deposit = accountService.deposit("12345", new BigDecimal("50"));

        // Then: balance is 150.0
        assertTrue(deposit.isSuccess());
        assertEquals(0, deposit.getAccount().getBalance().compareTo(new BigDecimal("150.0")));

        // When: withdrawing more than the balance
        AccountResult overdraft = accountService.withdraw("12345", new BigDecimal("200"));

        // Then: rejected and balance stays 150.0
        assertEquals(AccountError.INSUFFICIENT_FUNDS, overdraft.getError());
        assertEquals(0, accountService.balance("12345").orElseThrow().getBalance()
            .compareTo(new BigDecimal("150.0")));

        // When: withdrawing everything
        AccountResult withdrawal = accountService.withdraw("12345", new BigDecimal("150"));

        // Then: balance is zero
        assertTrue(withdrawal.isSuccess());
        assertEquals(0, accountService.balance("12345").orElseThrow().getBalance().compareTo(BigDecimal.ZERO));

        // And: unknown accounts are not found
        assertEquals(AccountError.ACCOUNT_NOT_FOUND, accountService.balance("99999").getError());
    }

    @Test
    @DisplayName("Invalid deposit is not saved")
    void testDeposit_InvalidAmount_NotSaved() {
        store.save(Account.of("ACC-1", new BigDecimal("20")));

        AccountResult result = accountService.deposit("ACC-1", new BigDecimal("-5"));

        assertEquals(AccountError.INVALID_AMOUNT, result.getError());
        assertEquals(0, store.fetch("ACC-1").orElseThrow().getBalance().compareTo(new BigDecimal("20")));
    }

    @Test
    @DisplayName("Deposit into an unknown account fails with ACCOUNT_NOT_FOUND")
    void testDeposit_UnknownAccount() {
        AccountResult result = accountService.deposit("missing", BigDecimal.TEN);

        assertEquals(AccountError.ACCOUNT_NOT_FOUND, result.getError());
        assertFalse(store.fetch("missing").isSuccess(), "Deposit must not create the account");
    }

    @Nested
    @DisplayName("Opening accounts")
    class OpenAccountTests {

        @Test
        @DisplayName("Opens with the given initial balance")
        void testOpen_WithInitialBalance() {
            AccountResult result = accountService.openAccount("ACC-2", new BigDecimal("25.00"));

            assertTrue(result.isSuccess());
            assertEquals(0, store.fetch("ACC-2").orElseThrow().getBalance().compareTo(new BigDecimal("25.00")));
        }

        @Test
        @DisplayName("Missing initial balance defaults to zero")
        void testOpen_DefaultsToZero() {
            AccountResult result = accountService.openAccount("ACC-3", null);

            assertEquals(0, result.orElseThrow().getBalance().compareTo(BigDecimal.ZERO));
        }

        @Test
        @DisplayName("Opening an existing id fails and keeps the original balance")
        void testOpen_Duplicate() {
            accountService.openAccount("ACC-4", new BigDecimal("10"));

            AccountResult result = accountService.openAccount("ACC-4", new BigDecimal("999"));

            assertEquals(AccountError.ACCOUNT_ALREADY_EXISTS, result.getError());
            assertEquals(0, store.fetch("ACC-4").orElseThrow().getBalance().compareTo(new BigDecimal("10")));
        }

        @Test
        @DisplayName("Blank id and negative initial balance are rejected")
        void testOpen_InvalidInput() {
            assertEquals(AccountError.INVALID_ACCOUNT_ID, accountService.openAccount(" ", BigDecimal.ONE).getError());
            assertEquals(AccountError.INVALID_AMOUNT,
                accountService.openAccount("ACC-5", new BigDecimal("-1")).getError());
            assertFalse(store.fetch("ACC-5").isSuccess());
        }

        @Test
        @DisplayName("Id longer than 64 characters is rejected before reaching the store")
        void testOpen_IdTooLong() {
            AccountResult result = accountService.openAccount("X".repeat(65), BigDecimal.ONE);

            assertEquals(AccountError.INVALID_ACCOUNT_ID, result.getError());
            assertTrue(accountService.openAccount("X".repeat(64), BigDecimal.ONE).isSuccess());
        }

        @Test
        @DisplayName("Initial balance that cannot be stored exactly is rejected")
        void testOpen_InitialBalanceOutOfRange() {
            assertEquals(AccountError.INVALID_AMOUNT,
                accountService.openAccount("ACC-6", new BigDecimal("0.00001")).getError());
            assertEquals(AccountError.INVALID_AMOUNT,
                accountService.openAccount("ACC-6", new BigDecimal("1E+20")).getError());
            assertFalse(store.fetch("ACC-6").isSuccess());
        }
    }

    @Test
    @DisplayName("Deposits beyond the storable precision or range are request errors")
    void testDeposit_OutsideStorableRange() {
        store.save(Account.of("ACC-1", new BigDecimal("100")));

        AccountResult tooPrecise = accountService.deposit("ACC-1", new BigDecimal("0.00001"));
        AccountResult tooLarge = accountService.deposit("ACC-1", new BigDecimal("1E+20"));

        assertEquals(AccountError.INVALID_AMOUNT, tooPrecise.getError());
        assertEquals(AccountError.INVALID_AMOUNT, tooLarge.getError());
        assertEquals(0, store.fetch("ACC-1").orElseThrow().getBalance().compareTo(new BigDecimal("100")));
    }

    @Test
    @DisplayName("Operations are counted by outcome")
    void testMetrics_RecordOutcomes() {
        store.save(Account.of("ACC-1", new BigDecimal("10")));

        accountService.deposit("ACC-1", BigDecimal.ONE);
        accountService.withdraw("ACC-1", new BigDecimal("100"));

        assertEquals(1.0, meterRegistry.counter(AccountMetrics.OPERATIONS_COUNTER,
            "operation", "deposit", "outcome", "success").count());
        assertEquals(1.0, meterRegistry.counter(AccountMetrics.OPERATIONS_COUNTER,
            "operation", "withdraw", "outcome", "insufficient_funds").count());
    }

    @Test
    @DisplayName("Storage errors become STORAGE_FAILURE with a generic message")
    void testStorageFailure_IsReportedGenerically() {
        AccountStore brokenStore = mock(AccountStore.class);
        when(brokenStore.updateBalance(anyString(), any()))
            .thenThrow(new DataAccessResourceFailureException("Connection refused: db-host:5432"));
        when(brokenStore.fetch(anyString()))
            .thenThrow(new DataAccessResourceFailureException("Connection refused: db-host:5432"));
        AccountService service = new AccountService(brokenStore, new AccountMetrics(meterRegistry));

        AccountResult withdrawal = service.withdraw("12345", BigDecimal.ONE);
        AccountResult balance = service.balance("12345");

        assertEquals(AccountError.STORAGE_FAILURE, withdrawal.getError());
        assertEquals(AccountError.STORAGE_FAILURE, balance.getError());
        assertFalse(withdrawal.getMessage().contains("db-host"), "Driver text must not leak to callers");
        verify(brokenStore, never()).save(any());
    }
}
