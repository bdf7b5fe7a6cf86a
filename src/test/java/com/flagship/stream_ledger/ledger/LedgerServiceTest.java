package com.flagship.stream_ledger.ledger;

import com.flagship.stream_ledger.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests that try to break the payout ledger.
 *
 * These tests attempt to violate ledger invariants:
 * - Imbalanced or empty transactions
 * - Non-positive amounts
 * - Reusing an owner under a different account type
 */
@SpringBootTest
@Import(TestClockConfig.class)
class LedgerServiceTest {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private String wallet1;
    private String wallet2;

    @BeforeEach
    void setUp() {
        wallet1 = "0xwallet-" + UUID.randomUUID().toString().substring(0, 8);
        wallet2 = "0xwallet-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    private void printExceptionDetails(Exception e) {
        String message = e.getMessage();
        if (e.getCause() != null && e.getCause().getMessage() != null) {
            message = e.getCause().getMessage();
        }
        System.out.println("  Exception Message: " + message);
    }

    private TransactionRequest.DebitCredit line(String owner, long amount) {
        return TransactionRequest.DebitCredit.of(owner, Account.AccountType.WALLET, amount, "line");
    }

    @Test
    @DisplayName("Valid balanced transaction should be processed successfully")
    void testValidBalancedTransaction() {
        printTestHeader("Valid Balanced Transaction");

        TransactionRequest request = TransactionRequest.transfer(
            "Transfer from wallet1 to wallet2",
            wallet1, Account.AccountType.WALLET,
            wallet2, Account.AccountType.WALLET,
            100L
        );
        printInput("Description", request.getDescription());
        printInput("Is Balanced", request.isBalanced());

        UUID transactionId = ledgerService.postTransaction(request);
        printOutput("Transaction ID", transactionId);

        List<LedgerEntry> entries = ledgerService.getLedgerEntriesForTransaction(transactionId);
        assertEquals(2, entries.size(), "Should have 2 ledger entries (1 debit, 1 credit)");

        // Credits increase an account, debits decrease it
        assertEquals(-100L, ledgerService.getBalance(wallet1));
        assertEquals(100L, ledgerService.getBalance(wallet2));
        printSuccess("All assertions passed");
    }

    @Test
    @DisplayName("Imbalanced transaction should be rejected")
    void testImbalancedTransaction_ShouldFail() {
        printTestHeader("Imbalanced Transaction");

        TransactionRequest request = new TransactionRequest(
            "Imbalanced transfer",
            List.of(line(wallet1, 100L)),
            List.of(line(wallet2, 50L))
        );
        printExpectedException("IllegalArgumentException",
            "Transaction is not balanced: debits=" + request.getDebitTotal() + ", credits=" + request.getCreditTotal());

        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> ledgerService.postTransaction(request));

        printExceptionDetails(exception);
        assertTrue(exception.getMessage().contains("not balanced"));
        assertTrue(accountService.findByOwner(wallet1).isEmpty(), "Rejected transaction should open no account");
        printSuccess("Imbalanced transaction rejected");
    }

    @Test
    @DisplayName("Multiple debits and credits that balance should succeed")
    void testMultipleDebitsAndCredits_Balanced() {
        String wallet3 = "0xwallet-" + UUID.randomUUID().toString().substring(0, 8);
        TransactionRequest request = new TransactionRequest(
            "Split transfer",
            List.of(line(wallet1, 70L), line(wallet2, 30L)),
            List.of(line(wallet3, 100L))
        );

        UUID transactionId = ledgerService.postTransaction(request);

        assertEquals(3, ledgerService.getLedgerEntriesForTransaction(transactionId).size());
        assertEquals(100L, ledgerService.getBalance(wallet3));
        assertEquals(-70L, ledgerService.getBalance(wallet1));
    }

    @Test
    @DisplayName("Zero amount should be rejected")
    void testZeroAmount_ShouldFail() {
        assertThrows(IllegalArgumentException.class, () -> line(wallet1, 0L));
    }

    @Test
    @DisplayName("Negative amount should be rejected")
    void testNegativeAmount_ShouldFail() {
        assertThrows(IllegalArgumentException.class, () -> line(wallet1, -5L));
    }

    @Test
    @DisplayName("Empty debits should be rejected")
    void testEmptyDebits_ShouldFail() {
        TransactionRequest request = new TransactionRequest("No debits", List.of(), List.of(line(wallet2, 10L)));

        assertThrows(IllegalArgumentException.class, () -> ledgerService.postTransaction(request));
    }

    @Test
    @DisplayName("Empty transaction should be rejected even though it balances")
    void testEmptyTransaction_ShouldFail() {
        TransactionRequest request = new TransactionRequest("Nothing", List.of(), List.of());

        assertTrue(request.isBalanced());
        assertThrows(IllegalArgumentException.class, () -> ledgerService.postTransaction(request));
    }

    @Test
    @DisplayName("Database should reject non-positive entry amounts written around the service")
    void testNonPositiveAmount_DatabaseEnforcement() {
        printTestHeader("Non-positive Amount - Database Level Enforcement");

        Account account = accountService.findOrCreateAccount(wallet1, Account.AccountType.WALLET);
        UUID transactionId = UUID.randomUUID();
        jdbcTemplate.update("INSERT INTO ledger_transactions (id, description) VALUES (?, ?)",
            transactionId, "Direct insert");

        Exception exception = assertThrows(Exception.class, () -> jdbcTemplate.update(
            "INSERT INTO ledger_entries (id, transaction_id, account_id, amount, entry_type) VALUES (?, ?, ?, ?, 'DEBIT')",
            UUID.randomUUID(), transactionId, account.getId(), 0L));

        printExceptionDetails(exception);
        printSuccess("Check constraint prevented a zero-amount entry");
    }

    @Test
    @DisplayName("Accounts should be opened once per owner")
    void testFindOrCreateAccount() {
        Account first = accountService.findOrCreateAccount(wallet1, Account.AccountType.WALLET);
        Account second = accountService.findOrCreateAccount(wallet1, Account.AccountType.WALLET);

        assertEquals(first.getId(), second.getId());
        assertEquals(wallet1, first.getOwner());
    }

    @Test
    @DisplayName("An owner cannot be reused under a different account type")
    void testAccountTypeMismatch() {
        accountService.findOrCreateAccount(wallet1, Account.AccountType.WALLET);

        assertThrows(IllegalArgumentException.class,
            () -> accountService.findOrCreateAccount(wallet1, Account.AccountType.REVENUE_POOL));
    }

    @Test
    @DisplayName("Unknown owners should have a zero balance")
    void testUnknownOwnerBalance() {
        assertEquals(0L, ledgerService.getBalance("0xnobody-" + UUID.randomUUID()));
    }

    @Test
    @DisplayName("Revenue pool owners should be derived from the stream id")
    void testRevenuePoolOwner() {
        UUID streamId = UUID.randomUUID();

        assertEquals("stream:" + streamId, Account.revenuePoolOwner(streamId));
    }
}
