package com.flagship.ledger_query.exception;

/**
 * Thrown when an account, expense or order reference does not resolve.
 * Surfaced to the caller as-is, never retried.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
