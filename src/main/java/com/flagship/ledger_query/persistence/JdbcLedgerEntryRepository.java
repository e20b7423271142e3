package com.flagship.ledger_query.persistence;

import com.flagship.ledger_query.ledger.EntryType;
import com.flagship.ledger_query.ledger.LedgerEntry;
import com.flagship.ledger_query.ledger.PaymentMethodType;
import com.flagship.ledger_query.ledger.TransactionKind;
import com.flagship.ledger_query.query.GroupingOrder;
import com.flagship.ledger_query.query.predicate.CompiledFilter;
import com.flagship.ledger_query.query.predicate.Join;
import com.flagship.ledger_query.query.predicate.JoinSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * PostgreSQL implementation of {@link LedgerEntryRepository}.
 *
 * No JPA here: ledger queries are built dynamically from the clause tree
 * and run through {@link NamedParameterJdbcTemplate}.
 */
@Repository
@Slf4j
public class JdbcLedgerEntryRepository implements LedgerEntryRepository {

    private static final String ENTRY_COLUMNS =
        "t.id, t.account_id, t.from_account_id, t.host_account_id, t.amount, t.currency, t.type, t.kind, " +
        "t.transaction_group, t.is_debt, t.payment_method_id, pm.type AS payment_method_type, " +
        "t.expense_id, t.order_id, t.created_at, t.using_gift_card_from_account_id, t.description";

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcLedgerEntryRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public long count(CompiledFilter filter) {
        SqlClauseRenderer renderer = new SqlClauseRenderer();
        String sql = "SELECT COUNT(*) FROM transactions t"
            + SqlClauseRenderer.joins(filter.getJoins())
            + renderer.where(filter);

        log.debug("Ledger count query: {}", sql);
        Long count = jdbcTemplate.queryForObject(sql, renderer.getParameters(), Long.class);
        return count != null ? count : 0L;
    }

    /**
     * Fetches the page and the total in one statement ({@code COUNT(*) OVER ()}).
     * An empty page past the first row carries no total, so only then a count query follows.
     */
    @Override
    public LedgerPage findPage(CompiledFilter filter, GroupingOrder order, int limit, int offset) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Page size must be positive, use count() for count-only queries");
        }
        CompiledFilter projected = filter.withJoin(JoinSpec.optional(Join.PAYMENT_METHOD));

        SqlClauseRenderer renderer = new SqlClauseRenderer();
        String sql = "SELECT " + ENTRY_COLUMNS + ", COUNT(*) OVER () AS total_count"
            + " FROM transactions t"
            + SqlClauseRenderer.joins(projected.getJoins())
            + renderer.where(projected)
            + orderBy(order, renderer)
            + " LIMIT " + renderer.bind(limit)
            + " OFFSET " + renderer.bind(offset);

        log.debug("Ledger page query: {}", sql);
        AtomicLong total = new AtomicLong(-1);
        List<LedgerEntry> entries = jdbcTemplate.query(sql, renderer.getParameters(), (rs, rowNum) -> {
            total.compareAndSet(-1, rs.getLong("total_count"));
            return mapEntry(rs);
        });

        if (!entries.isEmpty()) {
            return new LedgerPage(entries, total.get());
        }
        return new LedgerPage(entries, offset > 0 ? count(filter) : 0L);
    }

    @Override
    public List<TransactionKind> findDistinctKinds(CompiledFilter filter) {
        SqlClauseRenderer renderer = new SqlClauseRenderer();
        String sql = "SELECT DISTINCT t.kind FROM transactions t"
            + SqlClauseRenderer.joins(filter.getJoins())
            + renderer.where(filter);

        log.debug("Ledger kinds facet query: {}", sql);
        return jdbcTemplate.query(sql, renderer.getParameters(),
            (rs, rowNum) -> enumOrNull(TransactionKind.class, rs.getString("kind")));
    }

    @Override
    public List<PaymentMethodType> findDistinctPaymentMethodTypes(CompiledFilter filter) {
        CompiledFilter joined = filter.withJoin(JoinSpec.optional(Join.PAYMENT_METHOD));

        SqlClauseRenderer renderer = new SqlClauseRenderer();
        String sql = "SELECT DISTINCT pm.type AS payment_method_type FROM transactions t"
            + SqlClauseRenderer.joins(joined.getJoins())
            + renderer.where(joined);

        log.debug("Ledger payment method types facet query: {}", sql);
        return jdbcTemplate.query(sql, renderer.getParameters(),
            (rs, rowNum) -> enumOrNull(PaymentMethodType.class, rs.getString("payment_method_type")));
    }

    /**
     * Renders the grouping order. The CASE expressions are generated from the same
     * rank tables the in-memory comparator uses.
     */
    static String orderBy(GroupingOrder order, SqlClauseRenderer renderer) {
        String direction = " " + order.getDirection().name();
        List<String> keys = new ArrayList<>();
        for (GroupingOrder.Key key : order.getKeys()) {
            switch (key) {
                case TIME_BUCKET:
                    keys.add("ROUND(EXTRACT(EPOCH FROM t.created_at) / " + renderer.bind(order.getWindowSeconds()) + ")" + direction);
                    break;
                case GROUP:
                    keys.add("t.transaction_group" + direction);
                    break;
                case KIND_RANK:
                    keys.add(kindRankCase() + direction);
                    break;
                case TYPE_RANK:
                    keys.add("CASE WHEN t.type = '" + EntryType.DEBIT.name() + "' THEN "
                        + GroupingOrder.typeRank(EntryType.DEBIT) + " ELSE "
                        + GroupingOrder.typeRank(EntryType.CREDIT) + " END" + direction);
                    break;
                default:
                    throw new IllegalStateException("Unknown sort key: " + key);
            }
        }
        return " ORDER BY " + String.join(", ", keys);
    }

    private static String kindRankCase() {
        Map<Integer, List<TransactionKind>> kindsByRank = GroupingOrder.kindRanks().entrySet().stream()
            .collect(Collectors.groupingBy(Map.Entry::getValue, TreeMap::new,
                Collectors.mapping(Map.Entry::getKey, Collectors.toList())));

        StringBuilder sql = new StringBuilder("CASE");
        kindsByRank.forEach((rank, kinds) -> sql
            .append(" WHEN t.kind IN (")
            .append(kinds.stream().map(kind -> "'" + kind.name() + "'").collect(Collectors.joining(", ")))
            .append(") THEN ")
            .append(rank));
        return sql.append(" ELSE ").append(GroupingOrder.OTHER_KIND_RANK).append(" END").toString();
    }

    private static LedgerEntry mapEntry(ResultSet rs) throws SQLException {
        Timestamp createdAt = rs.getTimestamp("created_at");
        return LedgerEntry.builder()
            .id(rs.getLong("id"))
            .ownerAccountId(getNullableLong(rs, "account_id"))
            .counterpartyAccountId(getNullableLong(rs, "from_account_id"))
            .hostAccountId(getNullableLong(rs, "host_account_id"))
            .amount(rs.getLong("amount"))
            .currency(rs.getString("currency"))
            .type(enumOrNull(EntryType.class, rs.getString("type")))
            .kind(enumOrNull(TransactionKind.class, rs.getString("kind")))
            .groupId(rs.getString("transaction_group"))
            .debt(rs.getBoolean("is_debt"))
            .paymentMethodId(getNullableLong(rs, "payment_method_id"))
            .paymentMethodType(enumOrNull(PaymentMethodType.class, rs.getString("payment_method_type")))
            .linkedExpenseId(getNullableLong(rs, "expense_id"))
            .linkedOrderId(getNullableLong(rs, "order_id"))
            .createdAt(createdAt != null ? createdAt.toInstant() : null)
            .giftCardIssuerAccountId(getNullableLong(rs, "using_gift_card_from_account_id"))
            .description(rs.getString("description"))
            .build();
    }

    private static Long getNullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static <E extends Enum<E>> E enumOrNull(Class<E> type, String value) {
        return value != null ? Enum.valueOf(type, value) : null;
    }
}
