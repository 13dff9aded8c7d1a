package com.flagship.retail_ledger.ledger;

import com.flagship.retail_ledger.ledger.exception.AccountNotFoundException;
import com.flagship.retail_ledger.ledger.exception.InsufficientFundsException;
import com.flagship.retail_ledger.ledger.exception.RecipientNotFoundException;
import com.flagship.retail_ledger.ledger.exception.SelfTransferNotAllowedException;
import com.flagship.retail_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Money movement and balance derivation.
 *
 * This service enforces the core invariants:
 * 1. A balance is always derived from the transaction log, never stored
 * 2. A debit never takes an account below zero
 * 3. A transfer writes both of its legs or neither
 *
 * Every booking runs as one database transaction that starts by locking the
 * accounts involved (lowest account number first). The balance is then read,
 * checked and the new rows appended while the locks are held, so concurrent
 * debits on one account are serialized and cannot overdraw it.
 *
 * The service itself holds no mutable state; callers pass the account reference
 * of the authenticated customer explicitly.
 */
@Service
@Slf4j
public class LedgerService {

    static final String DEFAULT_DEPOSIT_DESCRIPTION = "Manual deposit";
    static final String DEFAULT_WITHDRAWAL_DESCRIPTION = "Cash withdrawal";
    static final int MAX_DESCRIPTION_LENGTH = 200;
    static final int MAX_CATEGORY_LENGTH = 50;

    private static final String ACCOUNT_ID_MDC_KEY = "accountId";
    private static final Pattern ACCOUNT_NUMBER = Pattern.compile("\\d{12}");

    private final LedgerStore store;
    private final LedgerTransactionRunner runner;
    private final LedgerMetrics metrics;
    private final boolean allowSelfTransfer;

    public LedgerService(LedgerStore store,
                         LedgerTransactionRunner runner,
                         LedgerMetrics metrics,
                         @Value("${ledger.transfer.allow-self:true}") boolean allowSelfTransfer) {
        this.store = store;
        this.runner = runner;
        this.metrics = metrics;
        this.allowSelfTransfer = allowSelfTransfer;
    }

    /**
     * Derives the balance of an account: deposits minus every outflow kind.
     *
     * @throws AccountNotFoundException if the account does not exist
     */
    public BigDecimal computeBalance(UUID accountId) {
        requireAccountId(accountId);
        return metrics.record("compute_balance", () -> runner.readOnly("compute_balance", () -> {
            requireAccount(accountId);
            return BalanceCalculator.balanceOf(store.listTransactions(accountId));
        }));
    }

    /**
     * All transactions of an account, oldest first.
     *
     * @throws AccountNotFoundException if the account does not exist
     */
    public List<LedgerTransaction> listTransactions(UUID accountId) {
        requireAccountId(accountId);
        return runner.readOnly("list_transactions", () -> {
            requireAccount(accountId);
            return store.listTransactions(accountId);
        });
    }

    /**
     * Balance, transaction count and the latest transactions of an account,
     * all read from the same snapshot.
     */
    public AccountStatement statement(UUID accountId, int recentLimit) {
        requireAccountId(accountId);
        if (recentLimit < 0) {
            throw new IllegalArgumentException("Recent transaction limit must not be negative");
        }
        return metrics.record("statement", () -> runner.readOnly("statement", () -> {
            Account account = requireAccount(accountId);
            List<LedgerTransaction> history = store.listTransactions(accountId);
            List<LedgerTransaction> recent = recentLimit == 0
                ? List.of()
                : store.recentTransactions(accountId, recentLimit);
            return new AccountStatement(account, BalanceCalculator.balanceOf(history), history.size(), recent);
        }));
    }

    /**
     * Credits an account. Deposits need no balance check but still take the
     * account lock, so they are ordered with concurrent debits.
     *
     * @throws com.flagship.retail_ledger.ledger.exception.InvalidAmountException if amount is not positive
     * @throws AccountNotFoundException if the account does not exist
     */
    public LedgerTransaction deposit(UUID accountId, BigDecimal amount, String description) {
        requireAccountId(accountId);
        BigDecimal validAmount = Amounts.requireValid(amount);
        String text = describe(description, DEFAULT_DEPOSIT_DESCRIPTION);

        return withAccountContext(accountId, () -> metrics.record("deposit", () ->
            runner.inTransaction("deposit", () -> {
                store.lockAccounts(List.of(requireAccount(accountId)));
                LedgerTransaction booked = store.append(
                    List.of(NewTransaction.deposit(accountId, validAmount, text))).get(0);
                log.info("Deposit booked: txId={}, amount={}", booked.getId(), booked.getAmount());
                return booked;
            })));
    }

    /**
     * Debits an account if its balance covers the amount.
     *
     * @throws InsufficientFundsException if amount exceeds the current balance
     * @throws AccountNotFoundException if the account does not exist
     */
    public LedgerTransaction withdraw(UUID accountId, BigDecimal amount, String description) {
        requireAccountId(accountId);
        BigDecimal validAmount = Amounts.requireValid(amount);
        String text = describe(description, DEFAULT_WITHDRAWAL_DESCRIPTION);

        return debit("withdraw", accountId, NewTransaction.withdrawal(accountId, validAmount, text));
    }

    /**
     * Debits an account towards a named third party (betting wallet, data bundle, ...).
     * Same rules as {@link #withdraw}, with the category as the transaction label.
     *
     * @throws IllegalArgumentException if the category is blank, too long or names a built-in kind
     * @throws InsufficientFundsException if amount exceeds the current balance
     */
    public LedgerTransaction fundCategory(UUID accountId, String category, BigDecimal amount, String description) {
        requireAccountId(accountId);
        String validCategory = requireCategory(category);
        BigDecimal validAmount = Amounts.requireValid(amount);
        String text = describe(description, validCategory);

        return debit("fund_category", accountId,
            NewTransaction.categoryFunding(accountId, validCategory, validAmount, text));
    }

    /**
     * Moves money from the sender to the account with the given number.
     * Writes a TRANSFER row on the sender and a DEPOSIT row on the recipient,
     * linked by a transfer id, in one atomic batch.
     *
     * @throws RecipientNotFoundException if no account has the recipient number
     * @throws SelfTransferNotAllowedException if self-transfers are disabled and both sides are the same account
     * @throws InsufficientFundsException if amount exceeds the sender's balance
     */
    public TransferResult transfer(UUID senderId, String recipientAccountNumber, BigDecimal amount, String description) {
        requireAccountId(senderId);
        BigDecimal validAmount = Amounts.requireValid(amount);
        String recipientNumber = recipientAccountNumber != null ? recipientAccountNumber.trim() : "";
        if (!ACCOUNT_NUMBER.matcher(recipientNumber).matches()) {
            throw new RecipientNotFoundException(recipientAccountNumber);
        }
        String note = normalizeDescription(description);

        return withAccountContext(senderId, () -> metrics.record("transfer", () ->
            runner.inTransaction("transfer", () -> {
                Account sender = requireAccount(senderId);
                Account recipient = store.findAccountByNumber(recipientNumber)
                    .orElseThrow(() -> new RecipientNotFoundException(recipientNumber));
                if (!allowSelfTransfer && sender.getId().equals(recipient.getId())) {
                    throw new SelfTransferNotAllowedException(sender.getAccountNumber());
                }

                store.lockAccounts(List.of(sender, recipient));
                ensureCovered(senderId, validAmount);

                UUID transferId = UUID.randomUUID();
                List<LedgerTransaction> legs = store.append(List.of(
                    NewTransaction.transferDebit(senderId, validAmount,
                        legDescription("Transfer to " + recipient.getAccountNumber(), note), transferId),
                    NewTransaction.transferCredit(recipient.getId(), validAmount,
                        legDescription("Transfer from " + sender.getAccountNumber(), note), transferId)
                ));

                log.info("Transfer booked: transferId={}, amount={}, from={}, to={}",
                    transferId, validAmount, sender.getAccountNumber(), recipient.getAccountNumber());
                return new TransferResult(transferId, legs.get(0), legs.get(1));
            })));
    }

    private LedgerTransaction debit(String operation, UUID accountId, NewTransaction row) {
        return withAccountContext(accountId, () -> metrics.record(operation, () ->
            runner.inTransaction(operation, () -> {
                store.lockAccounts(List.of(requireAccount(accountId)));
                ensureCovered(accountId, row.getAmount());
                LedgerTransaction booked = store.append(List.of(row)).get(0);
                log.info("{} booked: txId={}, label={}, amount={}",
                    operation, booked.getId(), booked.getLabel(), booked.getAmount());
                return booked;
            })));
    }

    /**
     * Must be called with the account lock held.
     */
    private void ensureCovered(UUID accountId, BigDecimal amount) {
        BigDecimal balance = BalanceCalculator.balanceOf(store.listTransactions(accountId));
        if (amount.compareTo(balance) > 0) {
            log.warn("Debit rejected: balance={}, requested={}", balance, amount);
            throw new InsufficientFundsException(accountId, balance, amount);
        }
    }

    private Account requireAccount(UUID accountId) {
        return store.findAccount(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    private static void requireAccountId(UUID accountId) {
        if (accountId == null) {
            throw new IllegalArgumentException("Account reference is required");
        }
    }

    private static String requireCategory(String category) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Funding category is required");
        }
        String trimmed = category.trim();
        if (trimmed.length() > MAX_CATEGORY_LENGTH) {
            throw new IllegalArgumentException(
                "Funding category must be at most " + MAX_CATEGORY_LENGTH + " characters");
        }
        if (TransactionKind.isBuiltInLabel(trimmed)) {
            throw new IllegalArgumentException("Funding category must not reuse a built-in kind: " + trimmed);
        }
        return trimmed;
    }

    private static String describe(String description, String fallback) {
        String normalized = normalizeDescription(description);
        return normalized != null ? normalized : fallback;
    }

    private static String normalizeDescription(String description) {
        if (description == null || description.isBlank()) {
            return null;
        }
        String trimmed = description.trim();
        if (trimmed.length() > MAX_DESCRIPTION_LENGTH) {
            throw new IllegalArgumentException(
                "Description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        return trimmed;
    }

    private static String legDescription(String prefix, String note) {
        return note != null ? prefix + ": " + note : prefix;
    }

    private static <T> T withAccountContext(UUID accountId, Supplier<T> work) {
        MDC.put(ACCOUNT_ID_MDC_KEY, accountId.toString());
        try {
            return work.get();
        } finally {
            MDC.remove(ACCOUNT_ID_MDC_KEY);
        }
    }
}
