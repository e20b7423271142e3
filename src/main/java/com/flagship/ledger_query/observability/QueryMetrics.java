package com.flagship.ledger_query.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Metrics of the ledger query engine.
 *
 * Metrics exposed:
 * - ledger.query.duration: Timer of complete queries, tagged by path (page or count)
 * - ledger.query.rejected: Counter of queries rejected before execution, tagged by reason
 * - ledger.query.facet.duration: Timer of facet computations, tagged by facet
 * - ledger.query.rows: Counter of entries returned
 */
@Component
public class QueryMetrics {

    private final MeterRegistry registry;
    private final Counter rowsReturned;

    public QueryMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.rowsReturned = Counter.builder("ledger.query.rows")
                .description("Number of ledger entries returned")
                .register(registry);
    }

    /**
     * Times a query. {@code path} is "count" for count-only queries, "page" otherwise.
     */
    public <T> T timeQuery(String path, Supplier<T> query) {
        return Timer.builder("ledger.query.duration")
                .description("Time taken to run a ledger query")
                .tag("path", path)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(query);
    }

    public <T> T timeFacet(String facet, Supplier<T> computation) {
        return registry.timer("ledger.query.facet.duration", "facet", facet).record(computation);
    }

    public void recordRejected(String reason) {
        registry.counter("ledger.query.rejected", "reason", sanitizeTag(reason)).increment();
    }

    public void recordRowsReturned(int rows) {
        rowsReturned.increment(rows);
    }

    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
    }
}
