package com.flagship.ledger_query.account;

import java.util.List;
import java.util.Optional;

/**
 * Resolves account references and walks account relationships
 * (children, incognito proxies).
 */
public interface AccountDirectory {

    /**
     * @throws com.flagship.ledger_query.exception.NotFoundException if the reference does not resolve
     */
    Account fetchAccount(AccountReference reference);

    /**
     * Resolves every reference, in order.
     *
     * @throws com.flagship.ledger_query.exception.NotFoundException if any reference does not resolve
     */
    List<Account> fetchAccounts(List<AccountReference> references);

    /**
     * Children of the given accounts, vendors excluded.
     */
    List<Account> getChildren(List<Account> parents);

    /**
     * Children of the given accounts, of every type.
     */
    List<Account> getAllChildren(List<Account> parents);

    Optional<Account> getIncognitoProfile(Long accountId);
}
