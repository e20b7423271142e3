package com.flagship.ledger_query.persistence;

import com.flagship.ledger_query.account.Account;
import com.flagship.ledger_query.account.InMemoryAccountDirectory;
import com.flagship.ledger_query.ledger.ExpenseType;
import com.flagship.ledger_query.ledger.LedgerEntry;
import com.flagship.ledger_query.ledger.PaymentMethodType;
import com.flagship.ledger_query.ledger.TransactionKind;
import com.flagship.ledger_query.query.GroupingOrder;
import com.flagship.ledger_query.query.predicate.Clause;
import com.flagship.ledger_query.query.predicate.Column;
import com.flagship.ledger_query.query.predicate.CompiledFilter;
import com.flagship.ledger_query.query.predicate.Join;
import com.flagship.ledger_query.query.predicate.JoinSpec;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Ledger repository evaluating clause trees in memory.
 * Counts the queries it runs so tests can check what was (not) executed.
 */
public class InMemoryLedgerEntryRepository implements LedgerEntryRepository {

    private final List<LedgerEntry> entries = new ArrayList<>();
    private final Map<Long, ExpenseType> expenseTypes = new HashMap<>();
    private final Map<Long, String> expenseVirtualCards = new HashMap<>();
    private final InMemoryAccountDirectory accounts;

    public final AtomicInteger countQueries = new AtomicInteger();
    public final AtomicInteger pageQueries = new AtomicInteger();
    public final AtomicInteger kindsQueries = new AtomicInteger();
    public final AtomicInteger paymentMethodTypesQueries = new AtomicInteger();

    public InMemoryLedgerEntryRepository(InMemoryAccountDirectory accounts) {
        this.accounts = accounts;
    }

    public void add(LedgerEntry entry) {
        entries.add(entry);
    }

    public void addExpense(long expenseId, ExpenseType type, String virtualCardId) {
        expenseTypes.put(expenseId, type);
        if (virtualCardId != null) {
            expenseVirtualCards.put(expenseId, virtualCardId);
        }
    }

    @Override
    public long count(CompiledFilter filter) {
        countQueries.incrementAndGet();
        return matching(filter).size();
    }

    @Override
    public LedgerPage findPage(CompiledFilter filter, GroupingOrder order, int limit, int offset) {
        pageQueries.incrementAndGet();
        List<LedgerEntry> matching = new ArrayList<>(matching(filter));
        matching.sort(order.comparator());
        int from = Math.min(offset, matching.size());
        int to = Math.min(from + limit, matching.size());
        return new LedgerPage(List.copyOf(matching.subList(from, to)), matching.size());
    }

    @Override
    public List<TransactionKind> findDistinctKinds(CompiledFilter filter) {
        kindsQueries.incrementAndGet();
        return new ArrayList<>(matching(filter).stream()
            .map(LedgerEntry::getKind)
            .collect(Collectors.toCollection(LinkedHashSet::new)));
    }

    @Override
    public List<PaymentMethodType> findDistinctPaymentMethodTypes(CompiledFilter filter) {
        paymentMethodTypesQueries.incrementAndGet();
        return new ArrayList<>(matching(filter).stream()
            .map(LedgerEntry::getPaymentMethodType)
            .collect(Collectors.toCollection(LinkedHashSet::new)));
    }

    private List<LedgerEntry> matching(CompiledFilter filter) {
        return entries.stream()
            .filter(entry -> joinsSatisfied(entry, filter))
            .filter(entry -> {
                InMemoryClauseEvaluator evaluator = new InMemoryClauseEvaluator(row(entry));
                for (Clause clause : filter.getClauses()) {
                    if (!clause.accept(evaluator)) {
                        return false;
                    }
                }
                return true;
            })
            .toList();
    }

    private boolean joinsSatisfied(LedgerEntry entry, CompiledFilter filter) {
        for (JoinSpec spec : filter.getJoins()) {
            if (!spec.isRequired()) {
                continue;
            }
            if (spec.getJoin() == Join.EXPENSE && !expenseTypes.containsKey(entry.getLinkedExpenseId())) {
                return false;
            }
            if (spec.getJoin() == Join.PAYMENT_METHOD && entry.getPaymentMethodId() == null) {
                return false;
            }
        }
        return true;
    }

    private Function<Column, Object> row(LedgerEntry entry) {
        return column -> {
            switch (column) {
                case ID: return entry.getId();
                case OWNER_ACCOUNT_ID: return entry.getOwnerAccountId();
                case COUNTERPARTY_ACCOUNT_ID: return entry.getCounterpartyAccountId();
                case HOST_ACCOUNT_ID: return entry.getHostAccountId();
                case AMOUNT: return entry.getAmount();
                case TYPE: return entry.getType();
                case KIND: return entry.getKind();
                case GROUP_ID: return entry.getGroupId();
                case IS_DEBT: return entry.isDebt();
                case CREATED_AT: return entry.getCreatedAt();
                case EXPENSE_ID: return entry.getLinkedExpenseId();
                case ORDER_ID: return entry.getLinkedOrderId();
                case PAYMENT_METHOD_ID: return entry.getPaymentMethodId();
                case GIFT_CARD_ISSUER_ACCOUNT_ID: return entry.getGiftCardIssuerAccountId();
                case DESCRIPTION: return entry.getDescription();
                case EXPENSE_TYPE: return expenseTypes.get(entry.getLinkedExpenseId());
                case EXPENSE_VIRTUAL_CARD_ID: return expenseVirtualCards.get(entry.getLinkedExpenseId());
                case PAYMENT_METHOD_TYPE: return entry.getPaymentMethodType();
                case OWNER_SLUG: return accountField(entry.getOwnerAccountId(), Account::getSlug);
                case OWNER_NAME: return accountField(entry.getOwnerAccountId(), Account::getName);
                case COUNTERPARTY_SLUG: return accountField(entry.getCounterpartyAccountId(), Account::getSlug);
                case COUNTERPARTY_NAME: return accountField(entry.getCounterpartyAccountId(), Account::getName);
                default: throw new IllegalArgumentException("Unknown column: " + column);
            }
        };
    }

    private Object accountField(Long accountId, Function<Account, String> field) {
        if (accountId == null) {
            return null;
        }
        Account account = accounts.get(accountId);
        return account != null ? field.apply(account) : null;
    }
}
