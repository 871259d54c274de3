package com.flagship.bank_account.account;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.function.Function;

/**
 * Account store backed by a single {@code accounts} table.
 *
 * Uses JDBC directly so the database enforces correctness:
 * 1. CHECK constraints reject negative balances and empty ids
 * 2. save() is one MERGE statement, never a check-then-write
 * 3. updateBalance() holds a row lock (SELECT ... FOR UPDATE) for the whole
 *    read-modify-write, so concurrent mutations of one account serialize
 *
 * The SQL sticks to what both H2 and PostgreSQL 15+ accept.
 */
@Repository
@ConditionalOnProperty(name = "bank.store.type", havingValue = "jdbc", matchIfMissing = true)
@Slf4j
public class JdbcAccountStore implements AccountStore {

    private static final String CREATE_TABLE_SQL =
        "CREATE TABLE IF NOT EXISTS accounts (" +
        "  id VARCHAR(64) PRIMARY KEY," +
        "  balance NUMERIC(19, 4) NOT NULL DEFAULT 0," +
        "  CONSTRAINT chk_accounts_id_not_empty CHECK (CHAR_LENGTH(id) > 0)," +
        "  CONSTRAINT chk_accounts_balance_non_negative CHECK (balance >= 0)" +
        ")";

    private static final String MERGE_SOURCE_SQL =
        "MERGE INTO accounts AS t " +
        "USING (SELECT CAST(? AS VARCHAR(64)) AS id, CAST(? AS NUMERIC(19, 4)) AS balance) AS s " +
        "ON t.id = s.id ";

    private static final String UPSERT_SQL = MERGE_SOURCE_SQL +
        "WHEN MATCHED THEN UPDATE SET balance = s.balance " +
        "WHEN NOT MATCHED THEN INSERT (id, balance) VALUES (s.id, s.balance)";

    private static final String INSERT_IF_ABSENT_SQL = MERGE_SOURCE_SQL +
        "WHEN NOT MATCHED THEN INSERT (id, balance) VALUES (s.id, s.balance)";

    private final JdbcTemplate jdbcTemplate;

    public JdbcAccountStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        initializeSchema();
    }

    /**
     * Creates the accounts table if it does not exist. Safe to call repeatedly.
     */
    public void initializeSchema() {
        jdbcTemplate.execute(CREATE_TABLE_SQL);
        log.debug("Ensured accounts table exists");
    }

    @Override
    @Transactional(readOnly = true)
    public AccountResult fetch(String id) {
        List<Account> rows = jdbcTemplate.query(
            "SELECT id, balance FROM accounts WHERE id = ?",
            accountRowMapper(),
            id
        );
        if (rows.isEmpty()) {
            return notFound(id);
        }
        return AccountResult.success(rows.get(0));
    }

    @Override
    @Transactional
    public void save(Account account) {
        jdbcTemplate.update(UPSERT_SQL, account.getId(), account.getBalance());
        log.debug("Saved account {} with balance {}", account.getId(), account.getBalance());
    }

    @Override
    public boolean createIfAbsent(Account account) {
        try {
            int inserted = jdbcTemplate.update(INSERT_IF_ABSENT_SQL, account.getId(), account.getBalance());
            return inserted > 0;
        } catch (DuplicateKeyException e) {
            // A concurrent insert won between the match and the write
            log.debug("Account {} was created concurrently", account.getId());
            return false;
        }
    }

    @Override
    @Transactional
    public AccountResult updateBalance(String id, Function<Account, AccountResult> mutation) {
        List<Account> rows = jdbcTemplate.query(
            "SELECT id, balance FROM accounts WHERE id = ? FOR UPDATE",
            accountRowMapper(),
            id
        );
        if (rows.isEmpty()) {
            return notFound(id);
        }

        AccountResult result = mutation.apply(rows.get(0));
        if (!result.isSuccess()) {
            return result;
        }

        Account updated = result.getAccount();
        if (!id.equals(updated.getId())) {
            throw new IllegalStateException(
                String.format("Mutation of account %s returned account %s", id, updated.getId()));
        }

        jdbcTemplate.update("UPDATE accounts SET balance = ? WHERE id = ?", updated.getBalance(), id);
        log.debug("Updated account {} balance to {}", id, updated.getBalance());
        return result;
    }

    private static AccountResult notFound(String id) {
        return AccountResult.failure(AccountError.ACCOUNT_NOT_FOUND, "Account not found: " + id);
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> Account.of(
            rs.getString("id"),
            rs.getBigDecimal("balance")
        );
    }
}
