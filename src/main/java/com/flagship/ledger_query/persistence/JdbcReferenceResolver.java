package com.flagship.ledger_query.persistence;

import com.flagship.ledger_query.exception.NotFoundException;
import com.flagship.ledger_query.query.EntityReference;
import com.flagship.ledger_query.query.ReferenceResolver;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Resolves expense and order references against their tables.
 *
 * Legacy ids are internal ids already and are used as-is: an unknown legacy id
 * simply matches no entry. Public ids must exist.
 */
@Component
public class JdbcReferenceResolver implements ReferenceResolver {

    private final JdbcTemplate jdbcTemplate;

    public JdbcReferenceResolver(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public long resolveExpenseId(EntityReference reference) {
        return resolve(reference, "expenses", "Expense");
    }

    @Override
    public long resolveOrderId(EntityReference reference) {
        return resolve(reference, "orders", "Order");
    }

    private long resolve(EntityReference reference, String table, String label) {
        if (reference.getLegacyId() != null) {
            return reference.getLegacyId();
        }
        if (reference.getId() == null || reference.getId().isBlank()) {
            throw new IllegalArgumentException(label + " reference requires an id or a legacyId");
        }
        // table comes from the two constants above, never from user input
        List<Long> ids = jdbcTemplate.queryForList(
            "SELECT id FROM " + table + " WHERE public_id = ?",
            Long.class,
            reference.getId()
        );
        if (ids.isEmpty()) {
            throw new NotFoundException(label + " Not Found: " + reference.getId());
        }
        return ids.get(0);
    }
}
