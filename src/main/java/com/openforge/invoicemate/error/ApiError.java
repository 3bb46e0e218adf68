package com.openforge.invoicemate.error;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured error body returned by every endpoint.  Never carries a stack trace.
 *
 * @param kind      machine-readable {@link ErrorKind} name
 * @param message   human-readable explanation
 * @param retryable whether the caller may try the same request once more
 */
public record ApiError(
        @JsonProperty("kind")      String  kind,
        @JsonProperty("message")   String  message,
        @JsonProperty("retryable") boolean retryable
) {

    public static ApiError of(ErrorKind kind, String message) {
        return new ApiError(kind.name(), message, kind.retryable());
    }
}
