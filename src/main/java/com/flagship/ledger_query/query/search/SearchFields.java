package com.flagship.ledger_query.query.search;

import com.flagship.ledger_query.query.predicate.Column;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Columns a search term is matched against, by category.
 */
@Value
@Builder
public class SearchFields {
    /** Exact numeric match. */
    @Singular
    List<Column> idFields;
    /** Exact match with a leading {@code @}, substring match otherwise. */
    @Singular
    List<Column> slugFields;
    /** Case-insensitive substring match. */
    @Singular
    List<Column> textFields;
    /** Match of a decimal term converted to minor units. */
    @Singular
    List<Column> amountFields;
}
