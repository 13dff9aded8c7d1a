package com.flagship.retail_ledger.ledger;

/**
 * Kind of account holder. Decides which profile fields are kept;
 * it never changes how a balance is computed.
 */
public enum AccountKind {
    INDIVIDUAL,
    MERCHANT
}
