package com.flagship.retail_ledger.ledger.exception;

public class AccountNotFoundException extends LedgerException {

    public AccountNotFoundException(Object accountRef) {
        super(LedgerErrorCode.ACCOUNT_NOT_FOUND, "Account not found: " + accountRef);
    }
}
