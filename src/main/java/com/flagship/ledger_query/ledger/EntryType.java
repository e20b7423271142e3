package com.flagship.ledger_query.ledger;

/**
 * Side of a ledger entry in double-entry accounting.
 * A DEBIT is the paying leg, a CREDIT the receiving leg.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
