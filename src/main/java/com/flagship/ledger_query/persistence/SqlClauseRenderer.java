package com.flagship.ledger_query.persistence;

import com.flagship.ledger_query.query.predicate.Clause;
import com.flagship.ledger_query.query.predicate.ClauseVisitor;
import com.flagship.ledger_query.query.predicate.Column;
import com.flagship.ledger_query.query.predicate.CompiledFilter;
import com.flagship.ledger_query.query.predicate.Join;
import com.flagship.ledger_query.query.predicate.JoinSpec;
import com.flagship.ledger_query.query.predicate.Operator;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders clause trees to PostgreSQL over the {@code transactions t} table.
 *
 * One renderer per statement: it allocates named parameters ({@code :p0, :p1, ...})
 * into its own parameter source.
 */
class SqlClauseRenderer implements ClauseVisitor<String> {

    private static final Map<Column, String> COLUMNS = new EnumMap<>(Column.class);
    private static final Map<Join, String> JOINS = new EnumMap<>(Join.class);

    static {
        COLUMNS.put(Column.ID, "t.id");
        COLUMNS.put(Column.OWNER_ACCOUNT_ID, "t.account_id");
        COLUMNS.put(Column.COUNTERPARTY_ACCOUNT_ID, "t.from_account_id");
        COLUMNS.put(Column.HOST_ACCOUNT_ID, "t.host_account_id");
        COLUMNS.put(Column.AMOUNT, "t.amount");
        COLUMNS.put(Column.TYPE, "t.type");
        COLUMNS.put(Column.KIND, "t.kind");
        COLUMNS.put(Column.GROUP_ID, "t.transaction_group");
        COLUMNS.put(Column.IS_DEBT, "t.is_debt");
        COLUMNS.put(Column.CREATED_AT, "t.created_at");
        COLUMNS.put(Column.EXPENSE_ID, "t.expense_id");
        COLUMNS.put(Column.ORDER_ID, "t.order_id");
        COLUMNS.put(Column.PAYMENT_METHOD_ID, "t.payment_method_id");
        COLUMNS.put(Column.GIFT_CARD_ISSUER_ACCOUNT_ID, "t.using_gift_card_from_account_id");
        COLUMNS.put(Column.DESCRIPTION, "t.description");
        COLUMNS.put(Column.EXPENSE_TYPE, "e.type");
        COLUMNS.put(Column.EXPENSE_VIRTUAL_CARD_ID, "e.virtual_card_id");
        COLUMNS.put(Column.PAYMENT_METHOD_TYPE, "pm.type");
        COLUMNS.put(Column.OWNER_SLUG, "oa.slug");
        COLUMNS.put(Column.OWNER_NAME, "oa.name");
        COLUMNS.put(Column.COUNTERPARTY_SLUG, "ca.slug");
        COLUMNS.put(Column.COUNTERPARTY_NAME, "ca.name");

        JOINS.put(Join.EXPENSE, "expenses e ON e.id = t.expense_id");
        JOINS.put(Join.PAYMENT_METHOD, "payment_methods pm ON pm.id = t.payment_method_id");
        JOINS.put(Join.OWNER_ACCOUNT, "accounts oa ON oa.id = t.account_id");
        JOINS.put(Join.COUNTERPARTY_ACCOUNT, "accounts ca ON ca.id = t.from_account_id");
    }

    private final MapSqlParameterSource parameters = new MapSqlParameterSource();
    private int parameterIndex;

    MapSqlParameterSource getParameters() {
        return parameters;
    }

    /**
     * Binds a value under a fresh parameter name and returns its placeholder.
     */
    String bind(Object value) {
        String name = "p" + parameterIndex++;
        parameters.addValue(name, toSqlValue(value));
        return ":" + name;
    }

    static String column(Column column) {
        return COLUMNS.get(column);
    }

    /**
     * {@code WHERE ...} for the filter, or an empty string when it has no clause.
     */
    String where(CompiledFilter filter) {
        if (filter.isEmpty()) {
            return "";
        }
        return " WHERE " + filter.getClauses().stream()
            .map(clause -> clause.accept(this))
            .collect(Collectors.joining(" AND "));
    }

    static String joins(List<JoinSpec> joins) {
        StringBuilder sql = new StringBuilder();
        for (JoinSpec spec : joins) {
            sql.append(spec.isRequired() ? " INNER JOIN " : " LEFT JOIN ")
                .append(JOINS.get(spec.getJoin()));
        }
        return sql.toString();
    }

    @Override
    public String visitComparison(Clause.Comparison clause) {
        String column = column(clause.getColumn());
        if (clause.getValue() == null) {
            throw new IllegalArgumentException("Cannot compare " + clause.getColumn() + " to null");
        }
        return column + " " + operator(clause.getOperator()) + " " + bind(clause.getValue());
    }

    @Override
    public String visitMagnitude(Clause.Magnitude clause) {
        return "ABS(" + column(clause.getColumn()) + ") " + operator(clause.getOperator()) + " " + bind(clause.getValue());
    }

    @Override
    public String visitMembership(Clause.Membership clause) {
        if (clause.getValues().isEmpty()) {
            return clause.isNegated() ? "TRUE" : "FALSE";
        }
        return column(clause.getColumn()) + (clause.isNegated() ? " NOT IN (" : " IN (") + bind(clause.getValues()) + ")";
    }

    @Override
    public String visitNullCheck(Clause.NullCheck clause) {
        return column(clause.getColumn()) + (clause.isExpectNull() ? " IS NULL" : " IS NOT NULL");
    }

    @Override
    public String visitNotTrue(Clause.NotTrue clause) {
        return column(clause.getColumn()) + " IS NOT TRUE";
    }

    @Override
    public String visitContains(Clause.Contains clause) {
        return column(clause.getColumn()) + " ILIKE " + bind("%" + escapeLike(clause.getFragment()) + "%");
    }

    @Override
    public String visitAnyOf(Clause.AnyOf clause) {
        if (clause.getClauses().isEmpty()) {
            return "FALSE";
        }
        return clause.getClauses().stream()
            .map(child -> child.accept(this))
            .collect(Collectors.joining(" OR ", "(", ")"));
    }

    @Override
    public String visitAllOf(Clause.AllOf clause) {
        if (clause.getClauses().isEmpty()) {
            return "TRUE";
        }
        return clause.getClauses().stream()
            .map(child -> child.accept(this))
            .collect(Collectors.joining(" AND ", "(", ")"));
    }

    private static String operator(Operator operator) {
        switch (operator) {
            case EQ:
                return "=";
            case GTE:
                return ">=";
            case LTE:
                return "<=";
            default:
                throw new IllegalArgumentException("Unsupported operator: " + operator);
        }
    }

    static String escapeLike(String fragment) {
        return fragment
            .replace("\\", "\\\\")
            .replace("%", "\\%")
            .replace("_", "\\_");
    }

    private static Object toSqlValue(Object value) {
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream()
                .map(SqlClauseRenderer::toSqlValue)
                .toList();
        }
        if (value instanceof Enum) {
            return ((Enum<?>) value).name();
        }
        if (value instanceof Instant) {
            return Timestamp.from((Instant) value);
        }
        return value;
    }
}
