package com.flagship.retail_ledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for account identity rows.
 *
 * No setters. Identity columns (id, account number, owner, kind, creation time)
 * are updatable = false; only the profile columns change, through
 * {@link #applyProfile(AccountProfile)}. Money never lives on this row.
 * {@link #fromDomain(Account)} is the only way to build one.
 */
@Entity
@Table(name = "accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_number", nullable = false, updatable = false, length = 12)
    private String accountNumber;

    @Column(name = "owner_reference", nullable = false, updatable = false)
    private String ownerReference;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_kind", nullable = false, updatable = false)
    private AccountKind kind;

    @Column
    private String username;

    @Column
    private String email;

    @Column(name = "first_name")
    private String firstName;

    @Column(name = "last_name")
    private String lastName;

    @Column(name = "date_of_birth")
    private String dateOfBirth;

    @Column
    private String bvn;

    @Column(name = "company_name")
    private String companyName;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    static AccountEntity fromDomain(Account account) {
        AccountProfile profile = (account.getProfile() != null ? account.getProfile() : AccountProfile.empty())
            .normalized();
        return new AccountEntity(
            account.getId(),
            account.getAccountNumber(),
            account.getOwnerReference(),
            account.getKind(),
            profile.getUsername(),
            profile.getEmail(),
            profile.getFirstName(),
            profile.getLastName(),
            profile.getDateOfBirth(),
            profile.getBvn(),
            profile.getCompanyName(),
            account.getCreatedAt()
        );
    }

    void applyProfile(AccountProfile profile) {
        AccountProfile normalized = profile.normalized();
        this.username = normalized.getUsername();
        this.email = normalized.getEmail();
        this.firstName = normalized.getFirstName();
        this.lastName = normalized.getLastName();
        this.dateOfBirth = normalized.getDateOfBirth();
        this.bvn = normalized.getBvn();
        this.companyName = normalized.getCompanyName();
    }

    public Account toDomain() {
        return new Account(
            id,
            accountNumber,
            ownerReference,
            kind,
            AccountProfile.builder()
                .username(username)
                .email(email)
                .firstName(firstName)
                .lastName(lastName)
                .dateOfBirth(dateOfBirth)
                .bvn(bvn)
                .companyName(companyName)
                .build(),
            createdAt
        );
    }
}
