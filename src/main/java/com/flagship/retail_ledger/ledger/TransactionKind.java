package com.flagship.retail_ledger.ledger;

/**
 * Closed set of transaction kinds.
 *
 * The direction of every kind is fixed here, so adding a kind without
 * deciding whether it credits or debits the account fails to compile.
 * Third-party outflows (betting wallets, data bundles, ...) all share
 * {@link #CATEGORY_FUNDING} and carry their own category label.
 */
public enum TransactionKind {
    DEPOSIT("Deposit"),
    WITHDRAWAL("Withdrawal"),
    TRANSFER("Transfer"),
    CATEGORY_FUNDING(null);

    private final String label;

    TransactionKind(String label) {
        this.label = label;
    }

    public Direction direction() {
        return switch (this) {
            case DEPOSIT -> Direction.INFLOW;
            case WITHDRAWAL, TRANSFER, CATEGORY_FUNDING -> Direction.OUTFLOW;
        };
    }

    /**
     * Display label of a built-in kind, or null for category funding
     * (its label is the category).
     */
    public String label() {
        return label;
    }

    /**
     * True if the given text names a built-in kind, ignoring case.
     * Categories may not reuse these names.
     */
    public static boolean isBuiltInLabel(String text) {
        for (TransactionKind kind : values()) {
            if (kind.label != null && kind.label.equalsIgnoreCase(text.trim())) {
                return true;
            }
        }
        return false;
    }

    public enum Direction {
        INFLOW,
        OUTFLOW
    }
}
