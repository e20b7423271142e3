package com.flagship.ledger_query.query.predicate;

/**
 * Relations of a ledger entry that filters may reach into.
 */
public enum Join {
    EXPENSE,
    PAYMENT_METHOD,
    OWNER_ACCOUNT,
    COUNTERPARTY_ACCOUNT
}
