package com.flagship.retail_ledger.ledger.exception;

/**
 * The store rejected a write because it broke a database constraint
 * (unique key, check constraint, append-only or transfer-leg trigger).
 */
public class LedgerConstraintViolationException extends LedgerException {

    private final String constraintName;

    public LedgerConstraintViolationException(String operation, String constraintName, Throwable cause) {
        super(LedgerErrorCode.CONSTRAINT_VIOLATION,
            String.format("Constraint violation during %s%s", operation,
                constraintName != null ? ": " + constraintName : ""),
            cause);
        this.constraintName = constraintName;
    }

    /**
     * Name of the violated constraint, or null when the database did not report one.
     */
    public String getConstraintName() {
        return constraintName;
    }
}
