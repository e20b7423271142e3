package com.flagship.ledger_query.query.scope;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * The pre-authenticated actor issuing a query.
 *
 * {@code scopes} is null for a full session and holds the granted scopes for a delegated token.
 */
@Value
@Builder
public class Requester {

    private static final Requester ANONYMOUS = Requester.builder().build();

    /** The requester's own account (their user profile), null when anonymous. */
    Long accountId;
    boolean root;
    @Builder.Default
    Set<Long> adminOfAccountIds = Set.of();
    Set<String> scopes;

    public static Requester anonymous() {
        return ANONYMOUS;
    }

    public boolean isAuthenticated() {
        return accountId != null;
    }
}
