package com.flagship.retail_ledger.ledger;

import com.flagship.retail_ledger.ledger.exception.InsufficientFundsException;
import com.flagship.retail_ledger.ledger.exception.LedgerConstraintViolationException;
import com.flagship.retail_ledger.ledger.exception.LedgerErrorCode;
import com.flagship.retail_ledger.ledger.exception.LedgerException;
import com.flagship.retail_ledger.ledger.exception.StorageUnavailableException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.sql.SQLException;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LedgerTransactionRunnerTest {

    @Test
    void uniqueKeyViolationCarriesConstraintName() {
        DataIntegrityViolationException cause = new DataIntegrityViolationException(
            "could not execute statement",
            new SQLException("ERROR: duplicate key value violates unique constraint \"uk_accounts_email\"", "23505"));

        LedgerException translated = LedgerTransactionRunner.translate("open_account", cause);

        assertInstanceOf(LedgerConstraintViolationException.class, translated);
        assertEquals("uk_accounts_email", ((LedgerConstraintViolationException) translated).getConstraintName());
        assertEquals(LedgerErrorCode.CONSTRAINT_VIOLATION, translated.getCode());
    }

    @Test
    void commitTimeCheckViolationIsAConstraintViolation() {
        TransactionSystemException cause = new TransactionSystemException("Could not commit JDBC transaction",
            new SQLException("ERROR: transfer must have two legs", "23514"));

        LedgerException translated = LedgerTransactionRunner.translate("transfer", cause);

        assertInstanceOf(LedgerConstraintViolationException.class, translated);
    }

    @Test
    void lockAndConnectionFailuresAreStorageUnavailable() {
        assertInstanceOf(StorageUnavailableException.class, LedgerTransactionRunner.translate("withdraw",
            new CannotAcquireLockException("lock timeout", new SQLException("canceling statement", "55P03"))));
        assertInstanceOf(StorageUnavailableException.class, LedgerTransactionRunner.translate("deposit",
            new CannotGetJdbcConnectionException("connection refused")));
    }

    @Test
    void ledgerExceptionsPassThroughAndRollBack() {
        PlatformTransactionManager transactionManager = mock(PlatformTransactionManager.class);
        TransactionStatus status = mock(TransactionStatus.class);
        when(transactionManager.getTransaction(any())).thenReturn(status);
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        LedgerTransactionRunner runner = new LedgerTransactionRunner(template, template);

        InsufficientFundsException rejected =
            new InsufficientFundsException(UUID.randomUUID(), BigDecimal.ONE, BigDecimal.TEN);

        LedgerException thrown = assertThrows(LedgerException.class,
            () -> runner.inTransaction("withdraw", () -> {
                throw rejected;
            }));

        assertSame(rejected, thrown);
        verify(transactionManager).rollback(status);
    }

    @Test
    void commitFailureIsTranslated() {
        PlatformTransactionManager transactionManager = mock(PlatformTransactionManager.class);
        TransactionStatus status = mock(TransactionStatus.class);
        when(transactionManager.getTransaction(any())).thenReturn(status);
        doThrow(new TransactionSystemException("commit failed",
            new SQLException("ERROR: check_transfer_legs", "23514")))
            .when(transactionManager).commit(status);
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        LedgerTransactionRunner runner = new LedgerTransactionRunner(template, template);

        assertThrows(LedgerConstraintViolationException.class,
            () -> runner.inTransaction("transfer", () -> "done"));
    }
}
