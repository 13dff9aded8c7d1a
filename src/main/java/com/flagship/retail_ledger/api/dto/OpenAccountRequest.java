package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.ledger.AccountKind;
import com.flagship.retail_ledger.ledger.AccountProfile;
import com.flagship.retail_ledger.ledger.OpenAccountCommand;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * Request DTO for opening an account.
 */
@Value
public class OpenAccountRequest {

    @NotNull(message = "Account kind is required")
    @JsonProperty("kind")
    AccountKind kind;

    @NotBlank(message = "Owner reference is required")
    @Size(max = 150, message = "Owner reference must be at most 150 characters")
    @JsonProperty("owner_reference")
    String ownerReference;

    @Valid
    @JsonProperty("profile")
    ProfilePayload profile;

    public OpenAccountCommand toCommand() {
        return new OpenAccountCommand(kind, ownerReference,
            profile != null ? profile.toProfile() : AccountProfile.empty());
    }

    @Value
    public static class ProfilePayload {

        @Size(max = 150)
        @JsonProperty("username")
        String username;

        @Size(max = 150)
        @JsonProperty("email")
        String email;

        @Size(max = 150)
        @JsonProperty("first_name")
        String firstName;

        @Size(max = 150)
        @JsonProperty("last_name")
        String lastName;

        @Size(max = 50)
        @JsonProperty("date_of_birth")
        String dateOfBirth;

        @Size(max = 50)
        @JsonProperty("bvn")
        String bvn;

        @Size(max = 150)
        @JsonProperty("company_name")
        String companyName;

        AccountProfile toProfile() {
            return AccountProfile.builder()
                .username(username)
                .email(email)
                .firstName(firstName)
                .lastName(lastName)
                .dateOfBirth(dateOfBirth)
                .bvn(bvn)
                .companyName(companyName)
                .build();
        }
    }
}
