package com.flagship.ledger_query.query.predicate;

import lombok.Value;

/**
 * A relation to join when evaluating a filter.
 * A required join drops entries with no related row (inner join);
 * an optional one keeps them with null related columns (left join).
 */
@Value
public class JoinSpec {
    Join join;
    boolean required;

    public static JoinSpec required(Join join) {
        return new JoinSpec(join, true);
    }

    public static JoinSpec optional(Join join) {
        return new JoinSpec(join, false);
    }
}
