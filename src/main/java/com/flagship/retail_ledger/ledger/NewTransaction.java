package com.flagship.retail_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.UUID;

/**
 * A transaction row about to be appended. Id and timestamp are assigned by the store.
 */
@Value
public class NewTransaction {
    UUID accountId;
    TransactionKind kind;
    String category;
    BigDecimal amount;
    String description;
    UUID transferId;

    private NewTransaction(UUID accountId, TransactionKind kind, String category,
                           BigDecimal amount, String description, UUID transferId) {
        this.accountId = Objects.requireNonNull(accountId, "accountId");
        this.kind = Objects.requireNonNull(kind, "kind");
        if ((kind == TransactionKind.CATEGORY_FUNDING) != (category != null)) {
            throw new IllegalArgumentException("Category is required for, and only for, category funding");
        }
        this.category = category;
        this.amount = Amounts.requireValid(amount);
        this.description = description;
        this.transferId = transferId;
    }

    public static NewTransaction deposit(UUID accountId, BigDecimal amount, String description) {
        return new NewTransaction(accountId, TransactionKind.DEPOSIT, null, amount, description, null);
    }

    public static NewTransaction withdrawal(UUID accountId, BigDecimal amount, String description) {
        return new NewTransaction(accountId, TransactionKind.WITHDRAWAL, null, amount, description, null);
    }

    public static NewTransaction categoryFunding(UUID accountId, String category,
                                                 BigDecimal amount, String description) {
        return new NewTransaction(accountId, TransactionKind.CATEGORY_FUNDING,
            Objects.requireNonNull(category, "category"), amount, description, null);
    }

    /**
     * Outflow leg of a transfer, booked on the sender.
     */
    public static NewTransaction transferDebit(UUID senderId, BigDecimal amount, String description, UUID transferId) {
        return new NewTransaction(senderId, TransactionKind.TRANSFER, null, amount, description,
            Objects.requireNonNull(transferId, "transferId"));
    }

    /**
     * Inflow leg of a transfer, booked on the recipient as a deposit.
     */
    public static NewTransaction transferCredit(UUID recipientId, BigDecimal amount, String description, UUID transferId) {
        return new NewTransaction(recipientId, TransactionKind.DEPOSIT, null, amount, description,
            Objects.requireNonNull(transferId, "transferId"));
    }
}
