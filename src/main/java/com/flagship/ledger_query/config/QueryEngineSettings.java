package com.flagship.ledger_query.config;

import lombok.Value;

import java.time.Duration;

/**
 * Tunables of the ledger query engine.
 */
@Value
public class QueryEngineSettings {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 10_000;

    int defaultLimit;
    /** Largest page size allowed without root privileges. */
    int maxLimit;
    /** Time bucket of the grouping order. */
    Duration groupingWindow;

    public static QueryEngineSettings defaults() {
        return new QueryEngineSettings(DEFAULT_LIMIT, MAX_LIMIT, Duration.ofSeconds(10));
    }
}
