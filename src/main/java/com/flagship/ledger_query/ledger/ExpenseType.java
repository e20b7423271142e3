package com.flagship.ledger_query.ledger;

public enum ExpenseType {
    INVOICE,
    RECEIPT,
    FUNDING_REQUEST,
    GRANT,
    UNCLASSIFIED,
    CHARGE,
    SETTLEMENT
}
