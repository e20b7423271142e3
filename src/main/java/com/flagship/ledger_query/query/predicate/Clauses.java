package com.flagship.ledger_query.query.predicate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Factory methods for {@link Clause} nodes.
 */
public final class Clauses {

    private Clauses() {
        // Utility class
    }

    public static Clause eq(Column column, Object value) {
        return new Clause.Comparison(column, Operator.EQ, value);
    }

    public static Clause gte(Column column, Object value) {
        return new Clause.Comparison(column, Operator.GTE, value);
    }

    public static Clause lte(Column column, Object value) {
        return new Clause.Comparison(column, Operator.LTE, value);
    }

    public static Clause absGte(Column column, long value) {
        return new Clause.Magnitude(column, Operator.GTE, value);
    }

    public static Clause absLte(Column column, long value) {
        return new Clause.Magnitude(column, Operator.LTE, value);
    }

    public static Clause absEq(Column column, long value) {
        return new Clause.Magnitude(column, Operator.EQ, value);
    }

    public static Clause in(Column column, Collection<?> values) {
        return new Clause.Membership(column, copy(values), false);
    }

    public static Clause notIn(Column column, Collection<?> values) {
        return new Clause.Membership(column, copy(values), true);
    }

    public static Clause isNull(Column column) {
        return new Clause.NullCheck(column, true);
    }

    public static Clause isNotNull(Column column) {
        return new Clause.NullCheck(column, false);
    }

    public static Clause isNotTrue(Column column) {
        return new Clause.NotTrue(column);
    }

    public static Clause contains(Column column, String fragment) {
        return new Clause.Contains(column, fragment);
    }

    public static Clause or(List<Clause> clauses) {
        return new Clause.AnyOf(List.copyOf(clauses));
    }

    public static Clause or(Clause... clauses) {
        return or(List.of(clauses));
    }

    public static Clause and(List<Clause> clauses) {
        return new Clause.AllOf(List.copyOf(clauses));
    }

    public static Clause and(Clause... clauses) {
        return and(List.of(clauses));
    }

    private static List<?> copy(Collection<?> values) {
        List<Object> copy = new ArrayList<>(values.size());
        for (Object value : values) {
            if (value == null) {
                throw new IllegalArgumentException("IN values cannot contain null, use isNull instead");
            }
            copy.add(value);
        }
        return Collections.unmodifiableList(copy);
    }
}
