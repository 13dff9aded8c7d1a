package com.flagship.retail_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain model for an Account.
 *
 * The id is the account reference callers pass to ledger operations.
 * The account number is the 12-digit identifier other customers use to send money.
 * Neither changes after the account is opened, and no balance is kept here:
 * it is always derived from the transaction log.
 */
@Value
public class Account {
    UUID id;
    String accountNumber;
    String ownerReference;
    AccountKind kind;
    AccountProfile profile;
    Instant createdAt;
}
