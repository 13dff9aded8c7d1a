package com.flagship.retail_ledger.ledger.exception;

/**
 * Base class of every typed ledger failure.
 * When one of these escapes an operation, nothing from that operation was committed.
 */
public abstract class LedgerException extends RuntimeException {

    private final LedgerErrorCode code;

    protected LedgerException(LedgerErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected LedgerException(LedgerErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public LedgerErrorCode getCode() {
        return code;
    }
}
