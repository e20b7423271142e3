package com.flagship.ledger_query.query;

public enum SortDirection {
    ASC,
    DESC
}
