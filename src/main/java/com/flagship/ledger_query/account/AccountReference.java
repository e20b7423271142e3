package com.flagship.ledger_query.account;

import lombok.Value;

/**
 * Reference to an account, either by its legacy numeric id or by its slug.
 * When both are set the legacy id wins.
 */
@Value
public class AccountReference {
    Long legacyId;
    String slug;

    public static AccountReference ofLegacyId(long legacyId) {
        return new AccountReference(legacyId, null);
    }

    public static AccountReference ofSlug(String slug) {
        return new AccountReference(null, slug);
    }

    /**
     * Parses a raw reference: digits are a legacy id, anything else a slug.
     */
    public static AccountReference parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Account reference cannot be blank");
        }
        String trimmed = raw.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            return ofLegacyId(Long.parseLong(trimmed));
        }
        return ofSlug(trimmed);
    }

    @Override
    public String toString() {
        return legacyId != null ? "#" + legacyId : "@" + slug;
    }
}
