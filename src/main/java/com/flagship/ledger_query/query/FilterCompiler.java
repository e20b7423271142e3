package com.flagship.ledger_query.query;

import com.flagship.ledger_query.ledger.PaymentMethodType;
import com.flagship.ledger_query.query.predicate.Clause;
import com.flagship.ledger_query.query.predicate.Clauses;
import com.flagship.ledger_query.query.predicate.Column;
import com.flagship.ledger_query.query.predicate.CompiledFilter;
import com.flagship.ledger_query.query.predicate.Join;
import com.flagship.ledger_query.query.predicate.JoinSpec;
import com.flagship.ledger_query.query.scope.AccountScope;
import com.flagship.ledger_query.query.search.SearchConditionBuilder;
import com.flagship.ledger_query.query.search.SearchFields;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Compiles a {@link QueryRequest} into a conjunction of clauses over the ledger.
 *
 * Pipeline: account scope clauses, then the field rules in {@link #rules} order,
 * then the {@code facetBase} snapshot, then the search term.
 */
@Component
@Slf4j
public class FilterCompiler {

    static final SearchFields TRANSACTION_SEARCH_FIELDS = SearchFields.builder()
        .idField(Column.ID)
        .idField(Column.EXPENSE_ID)
        .idField(Column.ORDER_ID)
        .slugField(Column.COUNTERPARTY_SLUG)
        .slugField(Column.OWNER_SLUG)
        .textField(Column.COUNTERPARTY_NAME)
        .textField(Column.OWNER_NAME)
        .textField(Column.DESCRIPTION)
        .amountField(Column.AMOUNT)
        .build();

    /**
     * A single filter dimension. Returns the filter unchanged when its field is absent.
     */
    @FunctionalInterface
    interface FilterRule {
        CompiledFilter apply(QueryRequest request, CompiledFilter filter);
    }

    private final ReferenceResolver referenceResolver;
    private final SearchConditionBuilder searchConditionBuilder;
    private final List<FilterRule> rules;

    public FilterCompiler(ReferenceResolver referenceResolver, SearchConditionBuilder searchConditionBuilder) {
        this.referenceResolver = referenceResolver;
        this.searchConditionBuilder = searchConditionBuilder;
        this.rules = List.of(
            this::type,
            this::group,
            this::amount,
            this::dates,
            this::expense,
            this::expenseType,
            this::order,
            this::debts,
            this::kind,
            this::paymentMethodType,
            this::virtualCard
        );
    }

    public CompiledQuery compile(QueryRequest request, AccountScope scope) {
        CompiledFilter filter = CompiledFilter.empty();
        for (Clause clause : scope.toClauses()) {
            filter = filter.with(clause);
        }
        for (FilterRule rule : rules) {
            filter = rule.apply(request, filter);
        }

        CompiledFilter facetBase = filter;
        filter = search(request, filter);

        log.debug("Compiled ledger query: clauses={}, joins={}, facetClauses={}",
            filter.getClauses().size(), filter.getJoins(), facetBase.getClauses().size());
        return new CompiledQuery(filter, facetBase);
    }

    private CompiledFilter type(QueryRequest request, CompiledFilter filter) {
        if (request.getType() == null) {
            return filter;
        }
        return filter.with(Clauses.eq(Column.TYPE, request.getType()));
    }

    private CompiledFilter group(QueryRequest request, CompiledFilter filter) {
        if (request.getGroup() == null) {
            return filter;
        }
        return filter.with(Clauses.eq(Column.GROUP_ID, request.getGroup()));
    }

    private CompiledFilter amount(QueryRequest request, CompiledFilter filter) {
        Long min = request.getMinAmount();
        Long max = request.getMaxAmount();
        if (min != null && max != null) {
            return filter.with(Clauses.and(
                Clauses.absGte(Column.AMOUNT, min),
                Clauses.absLte(Column.AMOUNT, max)));
        }
        if (min != null) {
            return filter.with(Clauses.absGte(Column.AMOUNT, min));
        }
        if (max != null) {
            return filter.with(Clauses.absLte(Column.AMOUNT, max));
        }
        return filter;
    }

    private CompiledFilter dates(QueryRequest request, CompiledFilter filter) {
        if (request.getDateFrom() != null) {
            filter = filter.with(Clauses.gte(Column.CREATED_AT, request.getDateFrom()));
        }
        if (request.getDateTo() != null) {
            filter = filter.with(Clauses.lte(Column.CREATED_AT, request.getDateTo()));
        }
        return filter;
    }

    private CompiledFilter expense(QueryRequest request, CompiledFilter filter) {
        if (request.getExpense() != null) {
            long expenseId = referenceResolver.resolveExpenseId(request.getExpense());
            filter = filter.with(Clauses.eq(Column.EXPENSE_ID, expenseId));
        }
        if (request.getHasExpense() != null) {
            filter = filter.with(request.getHasExpense()
                ? Clauses.isNotNull(Column.EXPENSE_ID)
                : Clauses.isNull(Column.EXPENSE_ID));
        }
        return filter;
    }

    private CompiledFilter expenseType(QueryRequest request, CompiledFilter filter) {
        if (isEmpty(request.getExpenseType())) {
            return filter;
        }
        return filter
            .withJoin(JoinSpec.required(Join.EXPENSE))
            .with(Clauses.in(Column.EXPENSE_TYPE, request.getExpenseType()));
    }

    private CompiledFilter order(QueryRequest request, CompiledFilter filter) {
        if (request.getOrder() != null) {
            long orderId = referenceResolver.resolveOrderId(request.getOrder());
            filter = filter.with(Clauses.eq(Column.ORDER_ID, orderId));
        }
        if (request.getHasOrder() != null) {
            filter = filter.with(request.getHasOrder()
                ? Clauses.isNotNull(Column.ORDER_ID)
                : Clauses.isNull(Column.ORDER_ID));
        }
        return filter;
    }

    private CompiledFilter debts(QueryRequest request, CompiledFilter filter) {
        if (request.isIncludeDebts()) {
            return filter;
        }
        return filter.with(Clauses.isNotTrue(Column.IS_DEBT));
    }

    private CompiledFilter kind(QueryRequest request, CompiledFilter filter) {
        if (isEmpty(request.getKind())) {
            return filter;
        }
        return filter.with(Clauses.in(Column.KIND, request.getKind()));
    }

    private CompiledFilter paymentMethodType(QueryRequest request, CompiledFilter filter) {
        if (isEmpty(request.getPaymentMethodType())) {
            return filter;
        }
        List<Clause> alternatives = new ArrayList<>();
        for (PaymentMethodType type : new LinkedHashSet<>(request.getPaymentMethodType())) {
            alternatives.add(type != null
                ? Clauses.eq(Column.PAYMENT_METHOD_TYPE, type)
                : Clauses.isNull(Column.PAYMENT_METHOD_ID));
        }
        return filter
            .withJoin(JoinSpec.optional(Join.PAYMENT_METHOD))
            .with(Clauses.or(alternatives));
    }

    private CompiledFilter virtualCard(QueryRequest request, CompiledFilter filter) {
        if (isEmpty(request.getVirtualCard())) {
            return filter;
        }
        List<String> virtualCardIds = request.getVirtualCard().stream()
            .map(VirtualCardReference::getId)
            .toList();
        return filter
            .withJoin(JoinSpec.required(Join.EXPENSE))
            .with(Clauses.in(Column.EXPENSE_VIRTUAL_CARD_ID, virtualCardIds));
    }

    private CompiledFilter search(QueryRequest request, CompiledFilter filter) {
        List<Clause> conditions = searchConditionBuilder.buildConditions(
            request.getSearchTerm(), TRANSACTION_SEARCH_FIELDS);
        if (conditions.isEmpty()) {
            return filter;
        }
        return filter
            .withJoin(JoinSpec.required(Join.COUNTERPARTY_ACCOUNT))
            .withJoin(JoinSpec.required(Join.OWNER_ACCOUNT))
            .with(Clauses.or(conditions));
    }

    private static boolean isEmpty(List<?> values) {
        return values == null || values.isEmpty();
    }
}
