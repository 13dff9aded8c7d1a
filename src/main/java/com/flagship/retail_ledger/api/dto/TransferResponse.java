package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.ledger.TransferResult;
import lombok.Value;

import java.util.UUID;

@Value
public class TransferResponse {

    @JsonProperty("transfer_id")
    UUID transferId;

    @JsonProperty("debit")
    TransactionResponse debit;

    @JsonProperty("credit")
    TransactionResponse credit;

    public static TransferResponse from(TransferResult result) {
        return new TransferResponse(
            result.getTransferId(),
            TransactionResponse.from(result.getDebit()),
            TransactionResponse.from(result.getCredit())
        );
    }
}
