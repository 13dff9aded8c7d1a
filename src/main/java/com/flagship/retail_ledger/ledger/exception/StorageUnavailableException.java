package com.flagship.retail_ledger.ledger.exception;

/**
 * The store could not complete the operation: connection failure,
 * lock wait timeout or transaction timeout. Fatal to the calling operation.
 */
public class StorageUnavailableException extends LedgerException {

    public StorageUnavailableException(String operation, Throwable cause) {
        super(LedgerErrorCode.STORAGE_UNAVAILABLE,
            "Ledger store unavailable during " + operation + ": " + cause.getMessage(),
            cause);
    }
}
