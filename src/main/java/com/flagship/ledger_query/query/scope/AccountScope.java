package com.flagship.ledger_query.query.scope;

import com.flagship.ledger_query.ledger.EntryType;
import com.flagship.ledger_query.query.predicate.Clause;
import com.flagship.ledger_query.query.predicate.Clauses;
import com.flagship.ledger_query.query.predicate.Column;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Account identities a query is restricted to, resolved for one request.
 *
 * Each side is null when the request did not reference it.
 */
@Value
@Builder
public class AccountScope {

    private static final AccountScope UNRESTRICTED = AccountScope.builder().build();

    /** Accounts on the other side of the entries ({@code fromAccount}). */
    Side counterparty;
    /** Accounts on the main side of the entries ({@code account}). */
    Side owner;
    HostSide host;

    public static AccountScope unrestricted() {
        return UNRESTRICTED;
    }

    /**
     * Ownership clauses, counterparty side first, then owner side, then host.
     */
    public List<Clause> toClauses() {
        List<Clause> clauses = new ArrayList<>();
        if (counterparty != null) {
            clauses.add(counterparty.toClause());
        }
        if (owner != null) {
            clauses.add(owner.toClause());
        }
        if (host != null) {
            clauses.addAll(host.toClauses());
        }
        return clauses;
    }

    /**
     * One side of the entries: the identities that may appear in {@code column}.
     * When gift card issuers are set, entries paid with gift cards issued by them
     * (with the given type) match too.
     */
    @Value
    @Builder
    public static class Side {
        Column column;
        List<Long> identityIds;
        boolean childrenIncluded;
        boolean incognitoIncluded;
        List<Long> giftCardIssuerIds;
        EntryType giftCardEntryType;

        public boolean isGiftCardIncluded() {
            return giftCardIssuerIds != null;
        }

        Clause toClause() {
            Clause identities = Clauses.in(column, identityIds);
            if (!isGiftCardIncluded()) {
                return identities;
            }
            return Clauses.or(
                Clauses.and(
                    Clauses.in(Column.GIFT_CARD_ISSUER_ACCOUNT_ID, giftCardIssuerIds),
                    Clauses.eq(Column.TYPE, giftCardEntryType)),
                identities);
        }
    }

    /**
     * Entries accounted by a host. {@code excludedOwnerIds} is null when the host's own
     * book-keeping entries are kept.
     */
    @Value
    public static class HostSide {
        Long hostId;
        List<Long> excludedOwnerIds;

        List<Clause> toClauses() {
            List<Clause> clauses = new ArrayList<>(2);
            if (excludedOwnerIds != null) {
                clauses.add(Clauses.notIn(Column.OWNER_ACCOUNT_ID, excludedOwnerIds));
            }
            clauses.add(Clauses.eq(Column.HOST_ACCOUNT_ID, hostId));
            return clauses;
        }
    }
}
