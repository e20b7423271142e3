package com.flagship.ledger_query.query.dto;

import com.flagship.ledger_query.account.AccountReference;
import com.flagship.ledger_query.ledger.EntryType;
import com.flagship.ledger_query.ledger.ExpenseType;
import com.flagship.ledger_query.ledger.PaymentMethodType;
import com.flagship.ledger_query.ledger.TransactionKind;
import com.flagship.ledger_query.query.EntityReference;
import com.flagship.ledger_query.query.OrderBy;
import com.flagship.ledger_query.query.QueryRequest;
import com.flagship.ledger_query.query.SortDirection;
import com.flagship.ledger_query.query.VirtualCardReference;
import jakarta.validation.constraints.Size;
import lombok.Data;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Query parameters of {@code GET /api/transactions}, bound by Spring MVC.
 *
 * Account references are slugs or legacy ids, expense and order references
 * public ids or legacy ids. {@code paymentMethodType=NONE} matches entries
 * without a payment method.
 */
@Data
public class TransactionQueryParams {

    public static final String NO_PAYMENT_METHOD = "NONE";

    private Integer limit;
    private Integer offset;
    private EntryType type;
    private List<String> paymentMethodType;
    private String fromAccount;
    private List<String> account;
    private String host;
    private SortDirection direction = SortDirection.DESC;
    private Long minAmount;
    private Long maxAmount;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
    private OffsetDateTime dateFrom;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
    private OffsetDateTime dateTo;

    @Size(max = 1000, message = "Search term must be at most 1000 characters")
    private String searchTerm;

    private Boolean hasExpense;
    private String expense;
    private List<ExpenseType> expenseType;
    private Boolean hasOrder;
    private String order;
    private boolean includeHost = true;
    private boolean includeRegularTransactions = true;
    private boolean includeIncognitoTransactions;
    private boolean includeChildrenTransactions;
    private boolean includeGiftCardTransactions;
    private boolean includeDebts;
    private List<TransactionKind> kind;
    private String group;

    @Size(max = 100, message = "At most 100 virtual cards can be filtered on")
    private List<String> virtualCard;

    /** Facets to compute: {@code kinds}, {@code paymentMethodTypes}. */
    private List<String> facets;

    public QueryRequest toQueryRequest() {
        return QueryRequest.builder()
            .limit(limit)
            .offset(offset)
            .type(type)
            .paymentMethodType(paymentMethodTypes())
            .fromAccount(fromAccount != null ? AccountReference.parse(fromAccount) : null)
            .account(account != null ? account.stream().map(AccountReference::parse).toList() : null)
            .host(host != null ? AccountReference.parse(host) : null)
            .orderBy(OrderBy.of(direction != null ? direction : SortDirection.DESC))
            .minAmount(minAmount)
            .maxAmount(maxAmount)
            .dateFrom(dateFrom != null ? dateFrom.toInstant() : null)
            .dateTo(dateTo != null ? dateTo.toInstant() : null)
            .searchTerm(searchTerm)
            .hasExpense(hasExpense)
            .expense(expense != null ? EntityReference.parse(expense) : null)
            .expenseType(expenseType)
            .hasOrder(hasOrder)
            .order(order != null ? EntityReference.parse(order) : null)
            .includeHost(includeHost)
            .includeRegularTransactions(includeRegularTransactions)
            .includeIncognitoTransactions(includeIncognitoTransactions)
            .includeChildrenTransactions(includeChildrenTransactions)
            .includeGiftCardTransactions(includeGiftCardTransactions)
            .includeDebts(includeDebts)
            .kind(kind)
            .group(group)
            .virtualCard(virtualCard != null ? virtualCard.stream().map(VirtualCardReference::new).toList() : null)
            .build();
    }

    public boolean wantsFacet(String facet) {
        return facets != null && facets.stream().anyMatch(facet::equalsIgnoreCase);
    }

    // May hold null elements, so no List.of / toList here
    private List<PaymentMethodType> paymentMethodTypes() {
        if (paymentMethodType == null) {
            return null;
        }
        List<PaymentMethodType> types = new ArrayList<>(paymentMethodType.size());
        for (String value : paymentMethodType) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            if (normalized.equals(NO_PAYMENT_METHOD) || normalized.equals("NULL")) {
                types.add(null);
            } else {
                try {
                    types.add(PaymentMethodType.valueOf(normalized));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Invalid payment method type: " + value, e);
                }
            }
        }
        return types;
    }
}
