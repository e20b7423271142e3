package com.flagship.ledger_query.ledger;

/**
 * Economic role of a ledger entry inside its transaction group.
 */
public enum TransactionKind {
    ADDED_FUNDS,
    BALANCE_TRANSFER,
    CONTRIBUTION,
    EXPENSE,
    HOST_FEE,
    HOST_FEE_SHARE,
    HOST_FEE_SHARE_DEBT,
    PAYMENT_PROCESSOR_COVER,
    PAYMENT_PROCESSOR_DISPUTE_FEE,
    PAYMENT_PROCESSOR_FEE,
    PLATFORM_FEE,
    PLATFORM_TIP,
    PLATFORM_TIP_DEBT,
    PREPAID_PAYMENT_METHOD,
    TAX
}
