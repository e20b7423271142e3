package com.flagship.ledger_query.query;

/**
 * Turns expense and order references into internal ids.
 */
public interface ReferenceResolver {

    /**
     * @throws com.flagship.ledger_query.exception.NotFoundException if the reference does not resolve
     */
    long resolveExpenseId(EntityReference reference);

    /**
     * @throws com.flagship.ledger_query.exception.NotFoundException if the reference does not resolve
     */
    long resolveOrderId(EntityReference reference);
}
