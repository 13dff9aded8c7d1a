package com.flagship.retail_ledger.ledger;

import com.flagship.retail_ledger.PostgresIntegrationTest;
import com.flagship.retail_ledger.ledger.exception.AccountNotFoundException;
import com.flagship.retail_ledger.ledger.exception.InsufficientFundsException;
import com.flagship.retail_ledger.ledger.exception.RecipientNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end ledger behaviour against PostgreSQL.
 */
class LedgerServiceIntegrationTest extends PostgresIntegrationTest {

    @Autowired
    private AccountService accountService;

    @Autowired
    private LedgerService ledgerService;

    private Account openAccount() {
        return accountService.openAccount(new OpenAccountCommand(
            AccountKind.INDIVIDUAL, "owner-" + UUID.randomUUID(), AccountProfile.empty()));
    }

    @Test
    @DisplayName("Deposit, rejected withdrawal and transfer keep both balances consistent")
    void testCustomerJourney() {
        printTestHeader("Customer journey");

        // Given: two fresh accounts, each seeded with the welcome bonus
        Account alice = openAccount();
        Account bob = openAccount();
        assertEquals(new BigDecimal("1000.00"), ledgerService.computeBalance(alice.getId()));

        // When: Alice deposits, overdraws, then transfers everything to Bob
        ledgerService.deposit(alice.getId(), new BigDecimal("500"), null);
        assertEquals(new BigDecimal("1500.00"), ledgerService.computeBalance(alice.getId()));

        assertThrows(InsufficientFundsException.class,
            () -> ledgerService.withdraw(alice.getId(), new BigDecimal("2000"), null));
        assertEquals(new BigDecimal("1500.00"), ledgerService.computeBalance(alice.getId()));

        TransferResult transfer = ledgerService.transfer(
            alice.getId(), bob.getAccountNumber(), new BigDecimal("1500"), null);
        printOutput("Transfer", transfer.getTransferId());

        // Then
        assertEquals(new BigDecimal("0.00"), ledgerService.computeBalance(alice.getId()));
        assertEquals(new BigDecimal("2500.00"), ledgerService.computeBalance(bob.getId()));

        List<LedgerTransaction> aliceHistory = ledgerService.listTransactions(alice.getId());
        assertEquals(3, aliceHistory.size());
        assertEquals(TransactionKind.TRANSFER, aliceHistory.get(2).getKind());
        assertEquals("Transfer to " + bob.getAccountNumber(), aliceHistory.get(2).getDescription());

        List<LedgerTransaction> bobHistory = ledgerService.listTransactions(bob.getId());
        assertEquals(2, bobHistory.size());
        assertEquals(transfer.getTransferId(), bobHistory.get(1).getTransferId());
        assertEquals("Transfer from " + alice.getAccountNumber(), bobHistory.get(1).getDescription());

        printSuccess("Balances 0.00 and 2500.00 after the journey");
    }

    @Test
    @DisplayName("Transfer to an unknown number leaves both balances unchanged")
    void testTransfer_UnknownRecipient_ShouldFail() {
        Account alice = openAccount();
        String unknown = unusedAccountNumber();

        assertThrows(RecipientNotFoundException.class,
            () -> ledgerService.transfer(alice.getId(), unknown, new BigDecimal("100"), null));

        assertEquals(new BigDecimal("1000.00"), ledgerService.computeBalance(alice.getId()));
        assertEquals(1, ledgerService.listTransactions(alice.getId()).size());
    }

    @Test
    @DisplayName("Persisted rows read back exactly as written")
    void testPersistedRowRoundTrip() {
        Account account = openAccount();

        LedgerTransaction booked = ledgerService.fundCategory(
            account.getId(), "Data Purchase", new BigDecimal("12.34"), "1GB weekly bundle");

        LedgerTransaction stored = ledgerService.listTransactions(account.getId()).get(1);
        assertEquals(booked, stored);
        assertEquals("Data Purchase", stored.getLabel());
        assertNotNull(stored.getCreatedAt());
        assertEquals(new BigDecimal("987.66"), ledgerService.computeBalance(account.getId()));
    }

    @Test
    @DisplayName("Self-transfer writes both legs and leaves the balance unchanged")
    void testSelfTransfer() {
        Account account = openAccount();

        TransferResult result = ledgerService.transfer(
            account.getId(), account.getAccountNumber(), new BigDecimal("250"), "move");

        assertEquals(account.getId(), result.getCredit().getAccountId());
        assertEquals(new BigDecimal("1000.00"), ledgerService.computeBalance(account.getId()));
        assertEquals(3, ledgerService.listTransactions(account.getId()).size());
    }

    @Test
    @DisplayName("Statement shows balance, count and newest rows first")
    void testStatement() {
        Account account = openAccount();
        ledgerService.deposit(account.getId(), new BigDecimal("10"), "first");
        ledgerService.withdraw(account.getId(), new BigDecimal("20"), "second");

        AccountStatement statement = ledgerService.statement(account.getId(), 2);

        assertEquals(new BigDecimal("990.00"), statement.getBalance());
        assertEquals(3L, statement.getTransactionCount());
        assertEquals(2, statement.getRecentTransactions().size());
        assertEquals("second", statement.getRecentTransactions().get(0).getDescription());
        assertEquals("first", statement.getRecentTransactions().get(1).getDescription());
    }

    @Test
    @DisplayName("History is ordered oldest first and re-reads are stable")
    void testHistoryOrdering() {
        Account account = openAccount();
        for (int i = 1; i <= 5; i++) {
            ledgerService.deposit(account.getId(), new BigDecimal(i), "deposit " + i);
        }

        List<LedgerTransaction> first = ledgerService.listTransactions(account.getId());
        List<LedgerTransaction> second = ledgerService.listTransactions(account.getId());

        assertEquals(first, second);
        for (int i = 1; i < first.size(); i++) {
            assertTrue(first.get(i - 1).getId() < first.get(i).getId());
            assertTrue(!first.get(i - 1).getCreatedAt().isAfter(first.get(i).getCreatedAt()));
        }
    }

    private String unusedAccountNumber() {
        RandomAccountNumberGenerator generator = new RandomAccountNumberGenerator();
        while (true) {
            String candidate = generator.nextAccountNumber();
            try {
                accountService.getAccountByNumber(candidate);
            } catch (AccountNotFoundException e) {
                return candidate;
            }
        }
    }
}
