package com.flagship.ledger_query.account;

public enum AccountType {
    USER,
    ORGANIZATION,
    COLLECTIVE,
    EVENT,
    PROJECT,
    FUND,
    /**
     * Vendors are attached to hosts as children but never own the host's transactions,
     * so they are skipped whenever children are expanded.
     */
    VENDOR
}
