package com.flagship.ledger_query.query.scope;

import com.flagship.ledger_query.account.Account;
import com.flagship.ledger_query.account.AccountDirectory;
import com.flagship.ledger_query.account.AccountReference;
import com.flagship.ledger_query.ledger.EntryType;
import com.flagship.ledger_query.query.QueryRequest;
import com.flagship.ledger_query.query.predicate.Column;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Expands the account references of a query into the identities it may see.
 *
 * {@code fromAccount} and {@code host} are resolved concurrently; {@code account}
 * references are resolved afterwards, in one batch.
 *
 * Incognito proxies are only ever included for the requester's own profile:
 * admins of an account never see its owner's incognito activity.
 */
@Component
@Slf4j
public class AccessScoper {

    private final AccountDirectory accountDirectory;
    private final PermissionChecker permissionChecker;
    private final Executor executor;

    public AccessScoper(AccountDirectory accountDirectory,
                        PermissionChecker permissionChecker,
                        @Qualifier("ledgerQueryExecutor") Executor executor) {
        this.accountDirectory = accountDirectory;
        this.permissionChecker = permissionChecker;
        this.executor = executor;
    }

    /**
     * Resolves the account scope of a request.
     *
     * @throws com.flagship.ledger_query.exception.NotFoundException if any reference does not resolve
     */
    public AccountScope resolve(QueryRequest request, Requester requester) {
        CompletableFuture<Account> fromAccountFuture = resolveAsync(request.getFromAccount());
        CompletableFuture<Account> hostFuture = resolveAsync(request.getHost());

        Account fromAccount = await(fromAccountFuture);
        Account host = await(hostFuture);

        AccountScope.AccountScopeBuilder scope = AccountScope.builder();
        if (fromAccount != null) {
            scope.counterparty(logSide("counterparty", counterpartySide(fromAccount, request, requester)));
        }
        if (request.getAccount() != null) {
            scope.owner(logSide("owner", ownerSide(request.getAccount(), request, requester)));
        }
        if (host != null) {
            scope.host(hostSide(host, request));
        }
        return scope.build();
    }

    private AccountScope.Side counterpartySide(Account fromAccount, QueryRequest request, Requester requester) {
        List<Long> identityIds = new ArrayList<>();

        if (request.isIncludeRegularTransactions()) {
            identityIds.add(fromAccount.getId());
        }

        if (request.isIncludeChildrenTransactions()) {
            accountDirectory.getChildren(List.of(fromAccount))
                .forEach(child -> identityIds.add(child.getId()));
        }

        boolean incognitoIncluded = false;
        if (request.isIncludeIncognitoTransactions() && mayIncludeIncognito(fromAccount, requester)) {
            Optional<Account> incognitoProfile = accountDirectory.getIncognitoProfile(fromAccount.getId());
            if (incognitoProfile.isPresent()) {
                identityIds.add(incognitoProfile.get().getId());
                incognitoIncluded = true;
            }
        }

        return AccountScope.Side.builder()
            .column(Column.COUNTERPARTY_ACCOUNT_ID)
            .identityIds(List.copyOf(identityIds))
            .childrenIncluded(request.isIncludeChildrenTransactions())
            .incognitoIncluded(incognitoIncluded)
            .giftCardIssuerIds(request.isIncludeGiftCardTransactions() ? List.of(fromAccount.getId()) : null)
            .giftCardEntryType(EntryType.CREDIT)
            .build();
    }

    private AccountScope.Side ownerSide(List<AccountReference> references, QueryRequest request, Requester requester) {
        List<Account> accounts = accountDirectory.fetchAccounts(references);

        Set<Long> identityIds = new LinkedHashSet<>();
        if (request.isIncludeRegularTransactions()) {
            accounts.forEach(account -> identityIds.add(account.getId()));
        }
        if (request.isIncludeChildrenTransactions()) {
            accountDirectory.getChildren(accounts)
                .forEach(child -> identityIds.add(child.getId()));
        }

        boolean incognitoIncluded = false;
        if (request.isIncludeIncognitoTransactions()
                && requester.isAuthenticated()
                && permissionChecker.hasScope(requester, PermissionChecker.INCOGNITO_SCOPE)
                && identityIds.contains(requester.getAccountId())) {
            Optional<Account> incognitoProfile = accountDirectory.getIncognitoProfile(requester.getAccountId());
            if (incognitoProfile.isPresent()) {
                identityIds.add(incognitoProfile.get().getId());
                incognitoIncluded = true;
            }
        }

        List<Long> accountIds = accounts.stream().map(Account::getId).distinct().toList();
        return AccountScope.Side.builder()
            .column(Column.OWNER_ACCOUNT_ID)
            .identityIds(List.copyOf(identityIds))
            .childrenIncluded(request.isIncludeChildrenTransactions())
            .incognitoIncluded(incognitoIncluded)
            .giftCardIssuerIds(request.isIncludeGiftCardTransactions() ? accountIds : null)
            .giftCardEntryType(EntryType.DEBIT)
            .build();
    }

    private static AccountScope.Side logSide(String role, AccountScope.Side side) {
        log.debug("Resolved {} scope: identities={}, childrenIncluded={}, incognitoIncluded={}",
            role, side.getIdentityIds(), side.isChildrenIncluded(), side.isIncognitoIncluded());
        return side;
    }

    private AccountScope.HostSide hostSide(Account host, QueryRequest request) {
        if (request.isIncludeHost()) {
            return new AccountScope.HostSide(host.getId(), null);
        }
        List<Long> hostAccountIds = new ArrayList<>();
        hostAccountIds.add(host.getId());
        accountDirectory.getAllChildren(List.of(host))
            .forEach(child -> hostAccountIds.add(child.getId()));
        return new AccountScope.HostSide(host.getId(), List.copyOf(hostAccountIds));
    }

    /**
     * All four conditions must hold: authenticated, admin of the account,
     * the account is the requester's own profile, and the incognito scope is granted.
     */
    private boolean mayIncludeIncognito(Account account, Requester requester) {
        boolean allowed = requester.isAuthenticated()
            && permissionChecker.isAdminOf(requester, account)
            && account.getId().equals(requester.getAccountId())
            && permissionChecker.hasScope(requester, PermissionChecker.INCOGNITO_SCOPE);
        if (!allowed) {
            log.debug("Incognito entries not included for account {}", account.getId());
        }
        return allowed;
    }

    private CompletableFuture<Account> resolveAsync(AccountReference reference) {
        if (reference == null) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.supplyAsync(() -> accountDirectory.fetchAccount(reference), executor);
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }
}
