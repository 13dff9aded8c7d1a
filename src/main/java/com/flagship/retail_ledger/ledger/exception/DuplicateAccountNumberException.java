package com.flagship.retail_ledger.ledger.exception;

/**
 * Every generated account number collided with an existing one.
 * Only raised after the retry budget is spent.
 */
public class DuplicateAccountNumberException extends LedgerException {

    public DuplicateAccountNumberException(int attempts) {
        super(LedgerErrorCode.DUPLICATE_ACCOUNT_NUMBER,
            "Could not generate a unique account number after " + attempts + " attempts");
    }
}
