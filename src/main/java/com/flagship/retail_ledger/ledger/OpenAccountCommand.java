package com.flagship.retail_ledger.ledger;

import lombok.Value;

/**
 * Input of account opening: who owns the account, its kind and opaque profile.
 */
@Value
public class OpenAccountCommand {
    AccountKind kind;
    String ownerReference;
    AccountProfile profile;
}
