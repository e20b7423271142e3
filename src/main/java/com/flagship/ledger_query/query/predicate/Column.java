package com.flagship.ledger_query.query.predicate;

/**
 * Logical columns a ledger query can filter on.
 * Columns living on a related entity name the join that makes them addressable.
 */
public enum Column {
    ID,
    OWNER_ACCOUNT_ID,
    COUNTERPARTY_ACCOUNT_ID,
    HOST_ACCOUNT_ID,
    AMOUNT,
    TYPE,
    KIND,
    GROUP_ID,
    IS_DEBT,
    CREATED_AT,
    EXPENSE_ID,
    ORDER_ID,
    PAYMENT_METHOD_ID,
    GIFT_CARD_ISSUER_ACCOUNT_ID,
    DESCRIPTION,
    EXPENSE_TYPE(Join.EXPENSE),
    EXPENSE_VIRTUAL_CARD_ID(Join.EXPENSE),
    PAYMENT_METHOD_TYPE(Join.PAYMENT_METHOD),
    OWNER_SLUG(Join.OWNER_ACCOUNT),
    OWNER_NAME(Join.OWNER_ACCOUNT),
    COUNTERPARTY_SLUG(Join.COUNTERPARTY_ACCOUNT),
    COUNTERPARTY_NAME(Join.COUNTERPARTY_ACCOUNT);

    private final Join join;

    Column() {
        this(null);
    }

    Column(Join join) {
        this.join = join;
    }

    /**
     * @return the relation this column lives on, or null for ledger columns
     */
    public Join getJoin() {
        return join;
    }
}
