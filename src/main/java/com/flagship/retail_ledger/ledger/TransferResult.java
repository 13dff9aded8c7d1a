package com.flagship.retail_ledger.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * The two legs written by one transfer. They share {@link #transferId}.
 */
@Value
public class TransferResult {
    UUID transferId;
    LedgerTransaction debit;
    LedgerTransaction credit;
}
