package com.flagship.ledger_query.query.scope;

import com.flagship.ledger_query.account.Account;
import org.springframework.stereotype.Component;

/**
 * Answers permission checks from the roles carried by the requester itself.
 * A user is always admin of their own profile.
 */
@Component
public class RequesterPermissionChecker implements PermissionChecker {

    @Override
    public boolean isRoot(Requester requester) {
        return requester != null && requester.isAuthenticated() && requester.isRoot();
    }

    @Override
    public boolean isAdminOf(Requester requester, Account account) {
        if (requester == null || !requester.isAuthenticated() || account == null) {
            return false;
        }
        return account.getId().equals(requester.getAccountId())
            || requester.getAdminOfAccountIds().contains(account.getId());
    }

    @Override
    public boolean hasScope(Requester requester, String scope) {
        if (requester == null || !requester.isAuthenticated()) {
            return false;
        }
        return requester.getScopes() == null || requester.getScopes().contains(scope);
    }
}
