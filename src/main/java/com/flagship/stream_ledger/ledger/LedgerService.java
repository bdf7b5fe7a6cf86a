package com.flagship.stream_ledger.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Service for posting native-currency movements to the payout ledger.
 *
 * This service enforces the core invariants:
 * 1. Debits must equal credits (balanced transactions)
 * 2. Ledger entries are immutable once written
 * 3. Postings join the caller's transaction, so they commit or roll back
 *    together with the stream balance change they record
 *
 * Balances are derived from entries, never stored: credits increase an
 * account, debits decrease it.
 */
@Service
@RequiredArgsConstructor
public class LedgerService {

    private final JdbcTemplate jdbcTemplate;
    private final AccountService accountService;

    /**
     * Posts a transaction to the ledger.
     *
     * @param request The transaction request with debits and credits
     * @return The UUID of the created transaction
     * @throws IllegalArgumentException if transaction is empty or not balanced
     */
    @Transactional
    public UUID postTransaction(TransactionRequest request) {
        if (request.getDebits().isEmpty() || request.getCredits().isEmpty()) {
            throw new IllegalArgumentException("Transaction must have at least one debit and one credit");
        }
        if (!request.isBalanced()) {
            throw new IllegalArgumentException(
                String.format("Transaction is not balanced: debits=%d, credits=%d",
                    request.getDebitTotal(), request.getCreditTotal()));
        }

        UUID transactionId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO ledger_transactions (id, description, created_at) VALUES (?, ?, CURRENT_TIMESTAMP)",
            transactionId,
            request.getDescription()
        );

        for (TransactionRequest.DebitCredit debit : request.getDebits()) {
            createLedgerEntry(transactionId, debit, EntryType.DEBIT);
        }
        for (TransactionRequest.DebitCredit credit : request.getCredits()) {
            createLedgerEntry(transactionId, credit, EntryType.CREDIT);
        }

        return transactionId;
    }

    private void createLedgerEntry(UUID transactionId, TransactionRequest.DebitCredit line, EntryType entryType) {
        Account account = accountService.findOrCreateAccount(line.getOwner(), line.getAccountType());
        jdbcTemplate.update(
            "INSERT INTO ledger_entries (id, transaction_id, account_id, amount, entry_type, description, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            UUID.randomUUID(),
            transactionId,
            account.getId(),
            line.getAmount(),
            entryType.name(),
            line.getDescription()
        );
    }

    /**
     * Gets the derived balance of an owner's account.
     * Unknown owners have a balance of zero.
     */
    @Transactional(readOnly = true)
    public long getBalance(String owner) {
        Long balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(CASE WHEN e.entry_type = 'CREDIT' THEN e.amount ELSE -e.amount END), 0) " +
            "FROM ledger_entries e JOIN ledger_accounts a ON a.id = e.account_id " +
            "WHERE a.owner = ?",
            Long.class,
            owner
        );
        return balance != null ? balance : 0L;
    }

    /**
     * Gets all ledger entries for a transaction.
     */
    @Transactional(readOnly = true)
    public List<LedgerEntry> getLedgerEntriesForTransaction(UUID transactionId) {
        return jdbcTemplate.query(
            "SELECT id, transaction_id, account_id, amount, entry_type, description " +
            "FROM ledger_entries WHERE transaction_id = ? ORDER BY entry_type DESC",
            ledgerEntryRowMapper(),
            transactionId
        );
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("transaction_id")),
            UUID.fromString(rs.getString("account_id")),
            rs.getLong("amount"),
            EntryType.valueOf(rs.getString("entry_type")),
            rs.getString("description")
        );
    }
}
