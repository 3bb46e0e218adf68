package com.openforge.invoicemate.error;

/**
 * Machine-readable classification of every failure the core can report.
 *
 * The {@code retryable} flag tells the calling layer whether a single bounded
 * retry can change the outcome.
 */
public enum ErrorKind {

    VALIDATION_ERROR(false),
    REWRITE_ERROR(false),
    UNKNOWN_TOOL(false),
    UPSTREAM_TIMEOUT(true),
    UPSTREAM_UNAVAILABLE(true),
    ISSUER_UNAVAILABLE(true),
    SERIALIZATION_ERROR(false),
    EXECUTION_FAILED(false),
    ACTION_ALREADY_EXECUTED(false),
    NO_PENDING_ACTION(false),
    PENDING_ACTION_CONFLICT(false),
    ROUND_LIMIT_EXCEEDED(false),
    INTERNAL_ERROR(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
