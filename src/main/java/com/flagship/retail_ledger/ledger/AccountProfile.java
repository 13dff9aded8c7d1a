package com.flagship.retail_ledger.ledger;

import lombok.Builder;
import lombok.Value;

/**
 * Identity metadata supplied at account opening and changed by the owner afterwards.
 * The ledger never interprets these values; it only trims them and stores
 * blank values as absent, so unique keys on username and e-mail ignore them.
 */
@Value
@Builder(toBuilder = true)
public class AccountProfile {
    String username;
    String email;
    String firstName;
    String lastName;
    String dateOfBirth;
    String bvn;
    String companyName;

    public static AccountProfile empty() {
        return AccountProfile.builder().build();
    }

    /**
     * Trims every value and turns blank ones into null.
     */
    public AccountProfile normalized() {
        return AccountProfile.builder()
            .username(blankToNull(username))
            .email(blankToNull(email))
            .firstName(blankToNull(firstName))
            .lastName(blankToNull(lastName))
            .dateOfBirth(blankToNull(dateOfBirth))
            .bvn(blankToNull(bvn))
            .companyName(blankToNull(companyName))
            .build();
    }

    /**
     * Keeps only the fields that belong to the given account kind.
     * Individuals carry personal details, merchants carry a company name.
     */
    public AccountProfile retainedFor(AccountKind kind) {
        return switch (kind) {
            case INDIVIDUAL -> toBuilder().companyName(null).build();
            case MERCHANT -> AccountProfile.builder()
                .username(username)
                .email(email)
                .companyName(companyName)
                .build();
        };
    }

    /**
     * Applies an owner's profile edit to this profile.
     *
     * Username and e-mail change only when a new value is given. The
     * kind-specific details (personal fields, or the company name) are
     * replaced as submitted, so an absent value clears them.
     */
    public AccountProfile updatedWith(AccountProfile changes, AccountKind kind) {
        AccountProfile edit = changes.normalized();
        AccountProfileBuilder updated = toBuilder()
            .username(edit.getUsername() != null ? edit.getUsername() : username)
            .email(edit.getEmail() != null ? edit.getEmail() : email);

        switch (kind) {
            case INDIVIDUAL -> updated
                .firstName(edit.getFirstName())
                .lastName(edit.getLastName())
                .dateOfBirth(edit.getDateOfBirth())
                .bvn(edit.getBvn());
            case MERCHANT -> updated.companyName(edit.getCompanyName());
        }
        return updated.build().retainedFor(kind);
    }

    private static String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
