package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.ledger.AccountStatement;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Dashboard view of an account: balance, activity count and latest transactions.
 */
@Value
public class StatementResponse {

    @JsonProperty("account")
    AccountResponse account;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("transaction_count")
    long transactionCount;

    @JsonProperty("recent_transactions")
    List<TransactionResponse> recentTransactions;

    public static StatementResponse from(AccountStatement statement) {
        return new StatementResponse(
            AccountResponse.from(statement.getAccount()),
            statement.getBalance(),
            statement.getTransactionCount(),
            statement.getRecentTransactions().stream().map(TransactionResponse::from).toList()
        );
    }
}
