package com.flagship.retail_ledger.ledger.exception;

/**
 * Distinguishable failure kinds of ledger operations.
 */
public enum LedgerErrorCode {
    INVALID_AMOUNT,
    INSUFFICIENT_FUNDS,
    RECIPIENT_NOT_FOUND,
    ACCOUNT_NOT_FOUND,
    SELF_TRANSFER_NOT_ALLOWED,
    DUPLICATE_ACCOUNT_NUMBER,
    CONSTRAINT_VIOLATION,
    STORAGE_UNAVAILABLE
}
