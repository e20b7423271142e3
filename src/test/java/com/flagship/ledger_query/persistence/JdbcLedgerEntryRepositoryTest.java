package com.flagship.ledger_query.persistence;

import com.flagship.ledger_query.AbstractLedgerIntegrationTest;
import com.flagship.ledger_query.ledger.EntryType;
import com.flagship.ledger_query.ledger.LedgerEntry;
import com.flagship.ledger_query.ledger.PaymentMethodType;
import com.flagship.ledger_query.ledger.TransactionKind;
import com.flagship.ledger_query.query.GroupingOrder;
import com.flagship.ledger_query.query.SortDirection;
import com.flagship.ledger_query.query.predicate.Clauses;
import com.flagship.ledger_query.query.predicate.Column;
import com.flagship.ledger_query.query.predicate.CompiledFilter;
import com.flagship.ledger_query.query.predicate.Join;
import com.flagship.ledger_query.query.predicate.JoinSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the SQL rendering against PostgreSQL.
 */
class JdbcLedgerEntryRepositoryTest extends AbstractLedgerIntegrationTest {

    @Autowired
    private JdbcLedgerEntryRepository repository;

    private static final CompiledFilter NOT_DEBT = CompiledFilter.empty().with(Clauses.isNotTrue(Column.IS_DEBT));

    private static List<Long> ids(List<LedgerEntry> entries) {
        return entries.stream().map(LedgerEntry::getId).toList();
    }

    @Test
    @DisplayName("SQL ordering matches the in-memory comparator in both directions")
    void sqlOrderMatchesComparator() {
        for (SortDirection direction : SortDirection.values()) {
            GroupingOrder order = new GroupingOrder(GroupingOrder.DEFAULT_WINDOW, direction);

            List<LedgerEntry> fromDatabase = repository.findPage(CompiledFilter.empty(), order, 100, 0).getEntries();
            List<LedgerEntry> sorted = new ArrayList<>(fromDatabase);
            sorted.sort(order.comparator());

            assertEquals(11, fromDatabase.size());
            assertEquals(ids(sorted), ids(fromDatabase), "direction " + direction);
        }
    }

    @Test
    @DisplayName("A wide window puts all events in one bucket, ordering them by group")
    void wideWindow() {
        GroupingOrder order = new GroupingOrder(Duration.ofHours(1), SortDirection.ASC);

        List<LedgerEntry> entries = repository.findPage(NOT_DEBT, order, 100, 0).getEntries();

        assertEquals(List.of("g1", "g1", "g1", "g1", "g2", "g2", "g3", "g3", "g4", "g4"),
            entries.stream().map(LedgerEntry::getGroupId).toList());
    }

    @Test
    @DisplayName("Page total equals the count query")
    void pageTotalMatchesCount() {
        CompiledFilter filter = NOT_DEBT.with(Clauses.eq(Column.TYPE, EntryType.DEBIT));

        LedgerPage page = repository.findPage(filter, GroupingOrder.defaultOrder(), 2, 0);

        assertEquals(2, page.getEntries().size());
        assertEquals(5, page.getTotalCount());
        assertEquals(5, repository.count(filter));
    }

    @Test
    @DisplayName("Empty page past the end falls back to a count")
    void emptyPageCount() {
        LedgerPage page = repository.findPage(NOT_DEBT, GroupingOrder.defaultOrder(), 5, 40);

        assertTrue(page.getEntries().isEmpty());
        assertEquals(NON_DEBT_ENTRIES, page.getTotalCount());
    }

    @Test
    @DisplayName("Entries are mapped with their payment method type")
    void mapping() {
        CompiledFilter filter = CompiledFilter.empty().with(Clauses.eq(Column.ID, 1L));

        LedgerEntry entry = repository.findPage(filter, GroupingOrder.defaultOrder(), 1, 0).getEntries().get(0);

        assertEquals(40L, entry.getOwnerAccountId());
        assertEquals(20L, entry.getCounterpartyAccountId());
        assertEquals(-1000L, entry.getAmount());
        assertEquals(EntryType.DEBIT, entry.getType());
        assertEquals(TransactionKind.CONTRIBUTION, entry.getKind());
        assertEquals(PaymentMethodType.CREDITCARD, entry.getPaymentMethodType());
        assertEquals(200L, entry.getLinkedOrderId());
        assertEquals(T0, entry.getCreatedAt());
        assertFalse(entry.isDebt());
    }

    @Test
    @DisplayName("Payment method types facet includes null for entries without payment method")
    void paymentMethodTypesFacet() {
        List<PaymentMethodType> types = repository.findDistinctPaymentMethodTypes(NOT_DEBT);

        assertEquals(new HashSet<>(Arrays.asList(PaymentMethodType.CREDITCARD, null)), new HashSet<>(types));
    }

    @Test
    @DisplayName("Kinds facet respects the filter and its joins")
    void kindsFacet() {
        CompiledFilter filter = NOT_DEBT
            .withJoin(JoinSpec.required(Join.EXPENSE))
            .with(Clauses.in(Column.EXPENSE_TYPE, List.of("INVOICE", "CHARGE")));

        assertEquals(Set.of(TransactionKind.EXPENSE), new HashSet<>(repository.findDistinctKinds(filter)));
    }

    @Test
    @DisplayName("Contains is case-insensitive and treats wildcards literally")
    void containsSearch() {
        CompiledFilter joined = CompiledFilter.empty()
            .withJoin(JoinSpec.required(Join.OWNER_ACCOUNT));

        assertEquals(2, repository.count(joined.with(Clauses.contains(Column.DESCRIPTION, "MONTHLY"))));
        assertEquals(0, repository.count(joined.with(Clauses.contains(Column.DESCRIPTION, "%"))));
        assertEquals(1, repository.count(joined.with(Clauses.contains(Column.OWNER_NAME, "print"))));
    }
}
