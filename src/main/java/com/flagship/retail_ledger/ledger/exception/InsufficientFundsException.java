package com.flagship.retail_ledger.ledger.exception;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A debit was larger than the balance derived under the account lock.
 */
public class InsufficientFundsException extends LedgerException {

    private final UUID accountId;
    private final BigDecimal balance;
    private final BigDecimal requested;

    public InsufficientFundsException(UUID accountId, BigDecimal balance, BigDecimal requested) {
        super(LedgerErrorCode.INSUFFICIENT_FUNDS,
            String.format("Insufficient funds in account %s: balance=%s, requested=%s",
                accountId, balance, requested));
        this.accountId = accountId;
        this.balance = balance;
        this.requested = requested;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public BigDecimal getBalance() {
        return balance;
    }

    public BigDecimal getRequested() {
        return requested;
    }
}
