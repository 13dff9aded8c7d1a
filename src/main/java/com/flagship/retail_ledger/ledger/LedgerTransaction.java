package com.flagship.retail_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A committed row of the transaction log.
 *
 * Immutable once written: the store refuses updates and deletes.
 * The amount is always positive; whether it adds to or subtracts from
 * the balance is decided by {@link TransactionKind#direction()}.
 */
@Value
public class LedgerTransaction {
    Long id;
    UUID accountId;
    TransactionKind kind;
    String category;
    BigDecimal amount;
    String description;
    UUID transferId;
    Instant createdAt;

    /**
     * Human-readable type: "Deposit", "Withdrawal", "Transfer" or the funding category.
     */
    public String getLabel() {
        return kind == TransactionKind.CATEGORY_FUNDING ? category : kind.label();
    }

    /**
     * Amount with the sign implied by the kind.
     */
    public BigDecimal signedAmount() {
        return switch (kind.direction()) {
            case INFLOW -> amount;
            case OUTFLOW -> amount.negate();
        };
    }
}
