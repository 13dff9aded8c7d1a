package com.flagship.retail_ledger.ledger.exception;

public class SelfTransferNotAllowedException extends LedgerException {

    public SelfTransferNotAllowedException(String accountNumber) {
        super(LedgerErrorCode.SELF_TRANSFER_NOT_ALLOWED,
            "Sender and recipient must be different accounts: " + accountNumber);
    }
}
