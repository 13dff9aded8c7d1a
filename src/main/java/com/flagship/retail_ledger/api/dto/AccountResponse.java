package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.ledger.Account;
import com.flagship.retail_ledger.ledger.AccountKind;
import com.flagship.retail_ledger.ledger.AccountProfile;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("owner_reference")
    String ownerReference;

    @JsonProperty("kind")
    AccountKind kind;

    @JsonProperty("username")
    String username;

    @JsonProperty("email")
    String email;

    @JsonProperty("first_name")
    String firstName;

    @JsonProperty("last_name")
    String lastName;

    @JsonProperty("date_of_birth")
    String dateOfBirth;

    @JsonProperty("bvn")
    String bvn;

    @JsonProperty("company_name")
    String companyName;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AccountResponse from(Account account) {
        AccountProfile profile = account.getProfile() != null ? account.getProfile() : AccountProfile.empty();
        return AccountResponse.builder()
            .id(account.getId())
            .accountNumber(account.getAccountNumber())
            .ownerReference(account.getOwnerReference())
            .kind(account.getKind())
            .username(profile.getUsername())
            .email(profile.getEmail())
            .firstName(profile.getFirstName())
            .lastName(profile.getLastName())
            .dateOfBirth(profile.getDateOfBirth())
            .bvn(profile.getBvn())
            .companyName(profile.getCompanyName())
            .createdAt(account.getCreatedAt())
            .build();
    }
}
