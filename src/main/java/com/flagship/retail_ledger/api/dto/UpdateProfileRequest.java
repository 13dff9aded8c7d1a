package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.ledger.AccountProfile;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * Request DTO for changing an account's profile.
 * Absent username or e-mail keeps the current value; the other fields are replaced as sent.
 */
@Value
public class UpdateProfileRequest {

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

    public AccountProfile toProfile() {
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
