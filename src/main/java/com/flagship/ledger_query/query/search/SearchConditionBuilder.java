package com.flagship.ledger_query.query.search;

import com.flagship.ledger_query.query.predicate.Clause;

import java.util.List;

/**
 * Turns a free-text search term into clauses to be OR'd together.
 */
public interface SearchConditionBuilder {

    /**
     * @return the alternative clauses, empty when the term is blank
     */
    List<Clause> buildConditions(String searchTerm, SearchFields fields);
}
