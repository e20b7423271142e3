package com.flagship.ledger_query.account;

import lombok.Value;

/**
 * Domain model for an Account.
 * Plain value object, decoupled from the JPA entity.
 */
@Value
public class Account {
    Long id;
    String slug;
    String name;
    AccountType type;
    Long parentAccountId;
    boolean incognito;
}
