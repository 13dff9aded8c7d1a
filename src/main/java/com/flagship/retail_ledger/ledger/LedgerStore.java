package com.flagship.retail_ledger.ledger;

import com.flagship.retail_ledger.ledger.exception.AccountNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable storage of accounts and the append-only transaction log.
 *
 * Account identity rows go through JPA; the transaction log is written and read
 * with plain JDBC so the SQL that touches money stays visible. Both share the
 * caller's database transaction.
 *
 * The store keeps no balance and no cache. It never updates or deletes a
 * transaction row; the database enforces the same with a trigger.
 */
@Repository
@Slf4j
public class LedgerStore {

    private static final String TRANSACTION_COLUMNS =
        "id, account_id, kind, category, amount, description, transfer_id, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final AccountRepository accountRepository;

    public LedgerStore(JdbcTemplate jdbcTemplate, AccountRepository accountRepository) {
        this.jdbcTemplate = jdbcTemplate;
        this.accountRepository = accountRepository;
    }

    public Optional<Account> findAccount(UUID accountId) {
        return accountRepository.findById(accountId).map(AccountEntity::toDomain);
    }

    public Optional<Account> findAccountByNumber(String accountNumber) {
        return accountRepository.findByAccountNumber(accountNumber).map(AccountEntity::toDomain);
    }

    public boolean existsByAccountNumber(String accountNumber) {
        return accountRepository.existsByAccountNumber(accountNumber);
    }

    /**
     * Inserts an account identity row and flushes, so a unique-key
     * collision surfaces here rather than at commit.
     */
    public Account saveAccount(Account account) {
        AccountEntity saved = accountRepository.saveAndFlush(AccountEntity.fromDomain(account));
        log.debug("Saved account {} with number {}", saved.getId(), saved.getAccountNumber());
        return saved.toDomain();
    }

    /**
     * Replaces the profile columns of an account under its row lock and flushes,
     * so a username or e-mail collision surfaces here rather than at commit.
     * Must run inside a transaction.
     *
     * @throws AccountNotFoundException if the account does not exist
     */
    public Account updateProfile(UUID accountId, AccountProfile profile) {
        AccountEntity entity = accountRepository.findByIdForUpdate(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
        entity.applyProfile(profile);
        AccountEntity saved = accountRepository.saveAndFlush(entity);
        log.debug("Updated profile of account {}", saved.getAccountNumber());
        return saved.toDomain();
    }

    /**
     * Takes write locks on the given accounts, lowest account number first.
     * The fixed order keeps two opposite-direction transfers from deadlocking.
     * Must run inside a transaction; locks are released at commit or rollback.
     *
     * @throws AccountNotFoundException if an account disappeared before it was locked
     */
    public void lockAccounts(Collection<Account> accounts) {
        Map<UUID, Account> distinct = new LinkedHashMap<>();
        for (Account account : accounts) {
            distinct.putIfAbsent(account.getId(), account);
        }
        List<Account> ordered = new ArrayList<>(distinct.values());
        ordered.sort(Comparator.comparing(Account::getAccountNumber));

        for (Account account : ordered) {
            accountRepository.findByIdForUpdate(account.getId())
                .orElseThrow(() -> new AccountNotFoundException(account.getId()));
            log.debug("Locked account {}", account.getAccountNumber());
        }
    }

    /**
     * All transactions of an account, oldest first (ties broken by id).
     * Re-reading returns the same rows plus anything committed since.
     */
    public List<LedgerTransaction> listTransactions(UUID accountId) {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM ledger_transactions " +
            "WHERE account_id = ? ORDER BY created_at, id",
            transactionRowMapper(),
            accountId
        );
    }

    /**
     * The latest transactions of an account, newest first.
     */
    public List<LedgerTransaction> recentTransactions(UUID accountId, int limit) {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM ledger_transactions " +
            "WHERE account_id = ? ORDER BY created_at DESC, id DESC LIMIT ?",
            transactionRowMapper(),
            accountId,
            limit
        );
    }

    /**
     * Appends a batch of transactions. Either every row is persisted or none:
     * joins the caller's transaction, or opens one for the batch.
     *
     * @return the persisted rows, in batch order, with id and timestamp assigned
     */
    @Transactional
    public List<LedgerTransaction> append(List<NewTransaction> batch) {
        if (batch.isEmpty()) {
            throw new IllegalArgumentException("Transaction batch must not be empty");
        }
        List<LedgerTransaction> persisted = new ArrayList<>(batch.size());
        for (NewTransaction row : batch) {
            persisted.add(insert(row));
        }
        return persisted;
    }

    private LedgerTransaction insert(NewTransaction row) {
        LedgerTransaction persisted = jdbcTemplate.queryForObject(
            "INSERT INTO ledger_transactions (account_id, kind, category, amount, description, transfer_id) " +
            "VALUES (?, ?, ?, ?, ?, ?) RETURNING " + TRANSACTION_COLUMNS,
            transactionRowMapper(),
            row.getAccountId(),
            row.getKind().name(),
            row.getCategory(),
            row.getAmount(),
            row.getDescription(),
            row.getTransferId()
        );
        log.debug("Appended transaction {} ({} {}) to account {}",
            persisted.getId(), persisted.getLabel(), persisted.getAmount(), persisted.getAccountId());
        return persisted;
    }

    private RowMapper<LedgerTransaction> transactionRowMapper() {
        return (rs, rowNum) -> {
            String transferId = rs.getString("transfer_id");
            return new LedgerTransaction(
                rs.getLong("id"),
                UUID.fromString(rs.getString("account_id")),
                TransactionKind.valueOf(rs.getString("kind")),
                rs.getString("category"),
                rs.getBigDecimal("amount"),
                rs.getString("description"),
                transferId != null ? UUID.fromString(transferId) : null,
                rs.getTimestamp("created_at").toInstant()
            );
        };
    }
}
