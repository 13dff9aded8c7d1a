package com.flagship.retail_ledger.ledger.exception;

import java.math.BigDecimal;

public class InvalidAmountException extends LedgerException {

    private final BigDecimal amount;

    public InvalidAmountException(BigDecimal amount, String reason) {
        super(LedgerErrorCode.INVALID_AMOUNT, "Invalid amount " + amount + ": " + reason);
        this.amount = amount;
    }

    public BigDecimal getAmount() {
        return amount;
    }
}
