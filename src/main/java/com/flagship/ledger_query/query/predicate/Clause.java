package com.flagship.ledger_query.query.predicate;

import lombok.Value;

import java.util.List;

/**
 * A node of the predicate tree over ledger entries.
 *
 * The tree is backend-neutral: it names logical columns and never carries SQL.
 * Instances are built through {@link Clauses}.
 */
public interface Clause {

    <R> R accept(ClauseVisitor<R> visitor);

    /**
     * {@code column <op> value}.
     */
    @Value
    class Comparison implements Clause {
        Column column;
        Operator operator;
        Object value;

        @Override
        public <R> R accept(ClauseVisitor<R> visitor) {
            return visitor.visitComparison(this);
        }
    }

    /**
     * {@code abs(column) <op> value}, a sign-agnostic bound on a signed amount.
     */
    @Value
    class Magnitude implements Clause {
        Column column;
        Operator operator;
        long value;

        @Override
        public <R> R accept(ClauseVisitor<R> visitor) {
            return visitor.visitMagnitude(this);
        }
    }

    /**
     * {@code column [NOT] IN (values)}. An empty IN matches nothing, an empty NOT IN everything.
     */
    @Value
    class Membership implements Clause {
        Column column;
        List<?> values;
        boolean negated;

        @Override
        public <R> R accept(ClauseVisitor<R> visitor) {
            return visitor.visitMembership(this);
        }
    }

    @Value
    class NullCheck implements Clause {
        Column column;
        boolean expectNull;

        @Override
        public <R> R accept(ClauseVisitor<R> visitor) {
            return visitor.visitNullCheck(this);
        }
    }

    /**
     * {@code column IS NOT TRUE}: false or null.
     */
    @Value
    class NotTrue implements Clause {
        Column column;

        @Override
        public <R> R accept(ClauseVisitor<R> visitor) {
            return visitor.visitNotTrue(this);
        }
    }

    /**
     * Case-insensitive substring match.
     */
    @Value
    class Contains implements Clause {
        Column column;
        String fragment;

        @Override
        public <R> R accept(ClauseVisitor<R> visitor) {
            return visitor.visitContains(this);
        }
    }

    @Value
    class AnyOf implements Clause {
        List<Clause> clauses;

        @Override
        public <R> R accept(ClauseVisitor<R> visitor) {
            return visitor.visitAnyOf(this);
        }
    }

    @Value
    class AllOf implements Clause {
        List<Clause> clauses;

        @Override
        public <R> R accept(ClauseVisitor<R> visitor) {
            return visitor.visitAllOf(this);
        }
    }
}
