package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.ledger.LedgerTransaction;
import com.flagship.retail_ledger.ledger.TransactionKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransactionResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("kind")
    TransactionKind kind;

    @JsonProperty("label")
    String label;

    @JsonProperty("direction")
    TransactionKind.Direction direction;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("description")
    String description;

    @JsonProperty("transfer_id")
    UUID transferId;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionResponse from(LedgerTransaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .accountId(transaction.getAccountId())
            .kind(transaction.getKind())
            .label(transaction.getLabel())
            .direction(transaction.getKind().direction())
            .amount(transaction.getAmount())
            .description(transaction.getDescription())
            .transferId(transaction.getTransferId())
            .createdAt(transaction.getCreatedAt())
            .build();
    }
}
