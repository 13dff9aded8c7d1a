package com.flagship.retail_ledger.ledger;

/**
 * Source of candidate account numbers. Candidates may collide;
 * uniqueness is checked against the store by the caller.
 */
@FunctionalInterface
public interface AccountNumberGenerator {

    String nextAccountNumber();
}
