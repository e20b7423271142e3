package com.flagship.ledger_query.account;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA Entity for accounts.
 *
 * Read-only from this service's point of view: no setters, no factory.
 * Rows are written by the account management side of the platform.
 */
@Entity
@Table(
    name = "accounts",
    indexes = {
        @Index(name = "idx_accounts_slug", columnList = "slug"),
        @Index(name = "idx_accounts_parent_account_id", columnList = "parent_account_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private Long id;

    @Column(nullable = false, unique = true)
    private String slug;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AccountType type;

    @Column(name = "parent_account_id")
    private Long parentAccountId;

    @Column(name = "is_incognito", nullable = false)
    private boolean incognito;

    /**
     * Set on incognito proxies only: the real account the proxy stands in for.
     */
    @Column(name = "incognito_owner_id")
    private Long incognitoOwnerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public Account toDomain() {
        return new Account(id, slug, name, type, parentAccountId, incognito);
    }
}
