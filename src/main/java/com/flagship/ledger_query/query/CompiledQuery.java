package com.flagship.ledger_query.query;

import com.flagship.ledger_query.query.predicate.CompiledFilter;
import lombok.Value;

/**
 * Output of the filter compiler.
 *
 * {@code filter} is the complete filter used for the page and the count.
 * {@code facetBase} is the snapshot taken just before the search term was applied,
 * used for facets so that they do not change while a search is being typed.
 */
@Value
public class CompiledQuery {
    CompiledFilter filter;
    CompiledFilter facetBase;
}
