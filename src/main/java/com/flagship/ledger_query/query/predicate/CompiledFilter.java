package com.flagship.ledger_query.query.predicate;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * An immutable conjunction of clauses plus the joins needed to evaluate them.
 *
 * Every {@code with*} method returns a new instance, so a filter captured at one
 * pipeline stage is never affected by clauses appended afterwards.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CompiledFilter {

    private static final CompiledFilter EMPTY = new CompiledFilter(List.of(), List.of());

    List<Clause> clauses;
    List<JoinSpec> joins;

    public static CompiledFilter empty() {
        return EMPTY;
    }

    public CompiledFilter with(Clause clause) {
        List<Clause> next = new ArrayList<>(clauses);
        next.add(clause);
        return new CompiledFilter(List.copyOf(next), joins);
    }

    /**
     * Adds a join. Joining the same relation twice keeps a single join,
     * required if either request was required.
     */
    public CompiledFilter withJoin(JoinSpec joinSpec) {
        List<JoinSpec> next = new ArrayList<>(joins.size() + 1);
        boolean merged = false;
        for (JoinSpec existing : joins) {
            if (existing.getJoin() == joinSpec.getJoin()) {
                next.add(new JoinSpec(existing.getJoin(), existing.isRequired() || joinSpec.isRequired()));
                merged = true;
            } else {
                next.add(existing);
            }
        }
        if (!merged) {
            next.add(joinSpec);
        }
        return new CompiledFilter(clauses, List.copyOf(next));
    }

    public boolean hasJoin(Join join) {
        return joins.stream().anyMatch(spec -> spec.getJoin() == join);
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }
}
