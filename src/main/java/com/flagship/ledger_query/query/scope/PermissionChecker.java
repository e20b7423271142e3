package com.flagship.ledger_query.query.scope;

import com.flagship.ledger_query.account.Account;

/**
 * Permission checks consumed by the query engine.
 */
public interface PermissionChecker {

    String INCOGNITO_SCOPE = "incognito";

    boolean isRoot(Requester requester);

    boolean isAdminOf(Requester requester, Account account);

    boolean hasScope(Requester requester, String scope);
}
