package com.flagship.ledger_query.observability;

import java.util.UUID;

/**
 * Thread-local context for correlation ID propagation.
 *
 * The correlation ID flows from the HTTP request (header or generated) into every
 * log statement of the query (via MDC) and back to the client as a response header.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String REQUESTER_ACCOUNT_ID_MDC_KEY = "requesterAccountId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    /**
     * Clears the correlation ID from the current thread.
     * Must be called at the end of request processing.
     */
    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short random id, readable in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
