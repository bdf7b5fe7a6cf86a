package com.flagship.stream_ledger.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for managing ledger accounts.
 *
 * Accounts are opened lazily the first time an owner takes part in a
 * transaction. One account per owner.
 */
@Service
public class AccountService {

    private final JdbcTemplate jdbcTemplate;

    public AccountService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Returns the owner's account, opening it if it does not exist yet.
     *
     * Concurrent callers opening the same account both end up with the
     * single row that won the insert.
     */
    @Transactional
    public Account findOrCreateAccount(String owner, Account.AccountType accountType) {
        jdbcTemplate.update(
            "INSERT INTO ledger_accounts (id, owner, account_type, created_at) " +
            "VALUES (?, ?, ?, CURRENT_TIMESTAMP) ON CONFLICT DO NOTHING",
            UUID.randomUUID(),
            owner,
            accountType.name()
        );
        Account account = findByOwner(owner)
            .orElseThrow(() -> new IllegalStateException("Account not found after insert: " + owner));
        if (account.getAccountType() != accountType) {
            throw new IllegalArgumentException(
                String.format("Account %s is a %s account, not %s", owner, account.getAccountType(), accountType));
        }
        return account;
    }

    @Transactional(readOnly = true)
    public Optional<Account> findByOwner(String owner) {
        List<Account> accounts = jdbcTemplate.query(
            "SELECT id, owner, account_type FROM ledger_accounts WHERE owner = ?",
            (rs, rowNum) -> new Account(
                UUID.fromString(rs.getString("id")),
                rs.getString("owner"),
                Account.AccountType.valueOf(rs.getString("account_type"))
            ),
            owner
        );
        return accounts.stream().findFirst();
    }
}
