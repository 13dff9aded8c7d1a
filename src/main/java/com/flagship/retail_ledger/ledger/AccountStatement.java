package com.flagship.retail_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Balance and recent activity of one account, read from a single snapshot.
 * Recent transactions are newest first.
 */
@Value
public class AccountStatement {
    Account account;
    BigDecimal balance;
    long transactionCount;
    List<LedgerTransaction> recentTransactions;
}
