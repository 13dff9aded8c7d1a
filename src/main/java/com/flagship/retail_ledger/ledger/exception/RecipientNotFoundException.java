package com.flagship.retail_ledger.ledger.exception;

public class RecipientNotFoundException extends LedgerException {

    private final String recipientAccountNumber;

    public RecipientNotFoundException(String recipientAccountNumber) {
        super(LedgerErrorCode.RECIPIENT_NOT_FOUND,
            "Recipient account not found: " + recipientAccountNumber);
        this.recipientAccountNumber = recipientAccountNumber;
    }

    public String getRecipientAccountNumber() {
        return recipientAccountNumber;
    }
}
