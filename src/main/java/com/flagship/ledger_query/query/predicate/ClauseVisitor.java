package com.flagship.ledger_query.query.predicate;

/**
 * Visitor over the clause tree. Each execution backend (SQL, in-memory) implements one.
 */
public interface ClauseVisitor<R> {

    R visitComparison(Clause.Comparison clause);

    R visitMagnitude(Clause.Magnitude clause);

    R visitMembership(Clause.Membership clause);

    R visitNullCheck(Clause.NullCheck clause);

    R visitNotTrue(Clause.NotTrue clause);

    R visitContains(Clause.Contains clause);

    R visitAnyOf(Clause.AnyOf clause);

    R visitAllOf(Clause.AllOf clause);
}
