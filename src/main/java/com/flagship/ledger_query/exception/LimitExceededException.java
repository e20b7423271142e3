package com.flagship.ledger_query.exception;

import java.util.Locale;

/**
 * Thrown when a page size above the allowed ceiling is requested
 * by a requester without root privileges.
 */
public class LimitExceededException extends RuntimeException {

    private final int requestedLimit;
    private final int maxLimit;

    public LimitExceededException(int requestedLimit, int maxLimit) {
        super(String.format(Locale.ROOT,
            "Cannot fetch more than %,d transactions at the same time, please adjust the limit", maxLimit));
        this.requestedLimit = requestedLimit;
        this.maxLimit = maxLimit;
    }

    public int getRequestedLimit() {
        return requestedLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }
}
