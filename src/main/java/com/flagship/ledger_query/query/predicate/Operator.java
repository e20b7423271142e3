package com.flagship.ledger_query.query.predicate;

public enum Operator {
    EQ,
    GTE,
    LTE
}
