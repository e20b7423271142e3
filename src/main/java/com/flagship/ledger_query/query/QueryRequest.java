package com.flagship.ledger_query.query;

import com.flagship.ledger_query.account.AccountReference;
import com.flagship.ledger_query.ledger.EntryType;
import com.flagship.ledger_query.ledger.ExpenseType;
import com.flagship.ledger_query.ledger.PaymentMethodType;
import com.flagship.ledger_query.ledger.TransactionKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Filter, sort and pagination parameters of a ledger query.
 *
 * Every filter is optional; an absent (or empty) filter adds no condition at all.
 * {@code limit} and {@code offset} are raw inputs, normalized by {@link LedgerQueryService}.
 */
@Value
@Builder(toBuilder = true)
public class QueryRequest {

    Integer limit;
    Integer offset;

    EntryType type;

    /**
     * Payment method types to match. A {@code null} element matches entries without a payment method.
     */
    List<PaymentMethodType> paymentMethodType;

    /**
     * Account on the other side of the entry (CREDIT: sender, DEBIT: recipient).
     */
    AccountReference fromAccount;

    /**
     * Accounts on the main side of the entry (CREDIT: recipient, DEBIT: sender).
     */
    List<AccountReference> account;

    AccountReference host;

    @Builder.Default
    OrderBy orderBy = OrderBy.DEFAULT;

    /** Lower bound on the absolute amount, in minor units. */
    Long minAmount;
    /** Upper bound on the absolute amount, in minor units. */
    Long maxAmount;

    Instant dateFrom;
    Instant dateTo;

    String searchTerm;

    Boolean hasExpense;
    EntityReference expense;
    List<ExpenseType> expenseType;

    Boolean hasOrder;
    EntityReference order;

    @Builder.Default
    boolean includeHost = true;
    @Builder.Default
    boolean includeRegularTransactions = true;
    boolean includeIncognitoTransactions;
    boolean includeChildrenTransactions;
    boolean includeGiftCardTransactions;
    boolean includeDebts;

    List<TransactionKind> kind;
    String group;
    List<VirtualCardReference> virtualCard;

    public static QueryRequest defaults() {
        return QueryRequest.builder().build();
    }
}
