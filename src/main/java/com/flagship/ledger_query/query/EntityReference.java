package com.flagship.ledger_query.query;

import lombok.Value;

/**
 * Reference to an expense or an order, by legacy numeric id or by public id.
 */
@Value
public class EntityReference {
    Long legacyId;
    String id;

    public static EntityReference ofLegacyId(long legacyId) {
        return new EntityReference(legacyId, null);
    }

    public static EntityReference ofPublicId(String id) {
        return new EntityReference(null, id);
    }

    /**
     * Digits are a legacy id, anything else a public id.
     */
    public static EntityReference parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Reference cannot be blank");
        }
        String trimmed = raw.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            return ofLegacyId(Long.parseLong(trimmed));
        }
        return ofPublicId(trimmed);
    }

    @Override
    public String toString() {
        return legacyId != null ? "#" + legacyId : id;
    }
}
