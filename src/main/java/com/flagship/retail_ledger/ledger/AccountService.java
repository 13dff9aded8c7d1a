package com.flagship.retail_ledger.ledger;

import com.flagship.retail_ledger.ledger.exception.AccountNotFoundException;
import com.flagship.retail_ledger.ledger.exception.DuplicateAccountNumberException;
import com.flagship.retail_ledger.ledger.exception.LedgerConstraintViolationException;
import com.flagship.retail_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Opens and looks up accounts.
 *
 * Opening an account writes the identity row and the seed deposit in one
 * database transaction, so an account never exists without its welcome bonus.
 * Account numbers are random; a number that is already taken (found by the
 * pre-check, or by the unique key when two openings race) is replaced by a
 * fresh one until the retry budget is spent.
 */
@Service
@Slf4j
public class AccountService {

    static final String ACCOUNT_NUMBER_CONSTRAINT = "uk_accounts_account_number";

    private final LedgerStore store;
    private final LedgerTransactionRunner runner;
    private final AccountNumberGenerator accountNumberGenerator;
    private final LedgerMetrics metrics;
    private final BigDecimal welcomeBonus;
    private final String welcomeDescription;
    private final int maxAttempts;

    public AccountService(LedgerStore store,
                          LedgerTransactionRunner runner,
                          AccountNumberGenerator accountNumberGenerator,
                          LedgerMetrics metrics,
                          @Value("${ledger.welcome-bonus.amount:1000.00}") BigDecimal welcomeBonus,
                          @Value("${ledger.welcome-bonus.description:Welcome bonus}") String welcomeDescription,
                          @Value("${ledger.account-number.max-attempts:5}") int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("ledger.account-number.max-attempts must be at least 1");
        }
        this.store = store;
        this.runner = runner;
        this.accountNumberGenerator = accountNumberGenerator;
        this.metrics = metrics;
        this.welcomeBonus = Amounts.requireValid(welcomeBonus);
        this.welcomeDescription = welcomeDescription;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Opens an account and books its welcome deposit.
     *
     * @param command kind, owner reference and profile of the new account
     * @return the opened account
     * @throws DuplicateAccountNumberException if no free account number was found within the retry budget
     * @throws LedgerConstraintViolationException if the profile breaks a unique key (username, e-mail)
     */
    public Account openAccount(OpenAccountCommand command) {
        validate(command);
        AccountProfile profile = (command.getProfile() != null ? command.getProfile() : AccountProfile.empty())
            .normalized()
            .retainedFor(command.getKind());

        return metrics.record("open_account", () -> {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                String candidate = accountNumberGenerator.nextAccountNumber();

                if (runner.readOnly("open_account", () -> store.existsByAccountNumber(candidate))) {
                    recordCollision(candidate, attempt);
                    continue;
                }

                try {
                    Account opened = runner.inTransaction("open_account", () -> {
                        Account account = store.saveAccount(new Account(
                            UUID.randomUUID(),
                            candidate,
                            command.getOwnerReference().trim(),
                            command.getKind(),
                            profile,
                            Instant.now()
                        ));
                        store.append(List.of(
                            NewTransaction.deposit(account.getId(), welcomeBonus, welcomeDescription)));
                        return account;
                    });
                    log.info("Account opened: accountId={}, accountNumber={}, kind={}",
                        opened.getId(), opened.getAccountNumber(), opened.getKind());
                    return opened;
                } catch (LedgerConstraintViolationException e) {
                    if (!ACCOUNT_NUMBER_CONSTRAINT.equals(e.getConstraintName())) {
                        log.warn("Account opening rejected: constraint={}", e.getConstraintName());
                        throw e;
                    }
                    recordCollision(candidate, attempt);
                }
            }
            log.error("Account opening failed: no unique account number after {} attempts", maxAttempts);
            throw new DuplicateAccountNumberException(maxAttempts);
        });
    }

    /**
     * Changes the profile of an existing account. Account number, kind and owner
     * reference never change; see {@link AccountProfile#updatedWith} for which
     * fields an edit touches.
     *
     * @throws AccountNotFoundException if the account does not exist
     * @throws LedgerConstraintViolationException if the new username or e-mail belongs to another account
     */
    public Account updateProfile(UUID accountId, AccountProfile changes) {
        if (accountId == null) {
            throw new IllegalArgumentException("Account reference is required");
        }
        if (changes == null) {
            throw new IllegalArgumentException("Profile changes are required");
        }

        return metrics.record("update_profile", () -> runner.inTransaction("update_profile", () -> {
            Account account = store.findAccount(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));
            AccountProfile updated = account.getProfile().updatedWith(changes, account.getKind());
            Account saved = store.updateProfile(accountId, updated);
            log.info("Profile updated: accountId={}, accountNumber={}", saved.getId(), saved.getAccountNumber());
            return saved;
        }));
    }

    /**
     * @throws AccountNotFoundException if the account does not exist
     */
    public Account getAccount(UUID accountId) {
        if (accountId == null) {
            throw new IllegalArgumentException("Account reference is required");
        }
        return runner.readOnly("get_account", () -> store.findAccount(accountId))
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    /**
     * @throws AccountNotFoundException if no account has the given number
     */
    public Account getAccountByNumber(String accountNumber) {
        if (accountNumber == null || accountNumber.isBlank()) {
            throw new IllegalArgumentException("Account number is required");
        }
        return runner.readOnly("get_account", () -> store.findAccountByNumber(accountNumber.trim()))
            .orElseThrow(() -> new AccountNotFoundException(accountNumber));
    }

    private void recordCollision(String candidate, int attempt) {
        metrics.recordAccountNumberCollision();
        log.warn("Account number {} already taken (attempt {}/{})", candidate, attempt, maxAttempts);
    }

    private static void validate(OpenAccountCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("Open account command is required");
        }
        if (command.getKind() == null) {
            throw new IllegalArgumentException("Account kind is required");
        }
        if (command.getOwnerReference() == null || command.getOwnerReference().isBlank()) {
            throw new IllegalArgumentException("Owner reference is required");
        }
    }
}
