package com.flagship.ledger_query.query;

import lombok.Value;

/**
 * Chronological ordering of a ledger query. Only the direction changes the result:
 * every page is sorted by the grouping order of {@link GroupingOrder}.
 */
@Value
public class OrderBy {

    public static final OrderBy DEFAULT = new OrderBy(Field.CREATED_AT, SortDirection.DESC);

    Field field;
    SortDirection direction;

    public static OrderBy of(SortDirection direction) {
        return new OrderBy(Field.CREATED_AT, direction);
    }

    public enum Field {
        CREATED_AT
    }
}
