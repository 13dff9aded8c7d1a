package com.flagship.retail_ledger.ledger;

import com.flagship.retail_ledger.ledger.exception.LedgerConstraintViolationException;
import com.flagship.retail_ledger.ledger.exception.LedgerException;
import com.flagship.retail_ledger.ledger.exception.StorageUnavailableException;
import jakarta.persistence.PersistenceException;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs ledger work as one database transaction and turns store failures
 * into typed ledger exceptions.
 *
 * Anything thrown inside the work rolls the whole unit back, so callers never
 * see a partially applied operation. Failures raised at commit time (deferred
 * constraint triggers) are translated the same way as failures in the body.
 */
@Component
public class LedgerTransactionRunner {

    private static final Pattern CONSTRAINT_NAME = Pattern.compile("constraint \"([^\"]+)\"");
    private static final String INTEGRITY_SQL_STATE_CLASS = "23";

    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readOnlyTemplate;

    public LedgerTransactionRunner(
            @Qualifier("ledgerTransactionTemplate") TransactionTemplate writeTemplate,
            @Qualifier("ledgerReadOnlyTransactionTemplate") TransactionTemplate readOnlyTemplate) {
        this.writeTemplate = writeTemplate;
        this.readOnlyTemplate = readOnlyTemplate;
    }

    public <T> T inTransaction(String operation, Supplier<T> work) {
        return run(writeTemplate, operation, work);
    }

    public <T> T readOnly(String operation, Supplier<T> work) {
        return run(readOnlyTemplate, operation, work);
    }

    private <T> T run(TransactionTemplate template, String operation, Supplier<T> work) {
        try {
            return template.execute(status -> work.get());
        } catch (LedgerException e) {
            throw e;
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            throw translate(operation, e);
        }
    }

    static LedgerException translate(String operation, RuntimeException e) {
        if (e instanceof DataIntegrityViolationException || findIntegrityViolation(e) != null) {
            return new LedgerConstraintViolationException(operation, constraintNameOf(e), e);
        }
        return new StorageUnavailableException(operation, e);
    }

    private static SQLException findIntegrityViolation(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException) {
                String sqlState = ((SQLException) cause).getSQLState();
                if (sqlState != null && sqlState.startsWith(INTEGRITY_SQL_STATE_CLASS)) {
                    return (SQLException) cause;
                }
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return null;
    }

    private static String constraintNameOf(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException) {
                String name = ((ConstraintViolationException) cause).getConstraintName();
                if (name != null) {
                    return name;
                }
            }
            if (cause.getMessage() != null) {
                Matcher matcher = CONSTRAINT_NAME.matcher(cause.getMessage());
                if (matcher.find()) {
                    return matcher.group(1);
                }
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return null;
    }
}
