package com.openforge.invoicemate.email;

/**
 * SMTP delivery failed. Transient failures (connection, timeout) are retried
 * once; permanent ones (authentication, rejected address) are not.
 */
public class EmailDeliveryException extends RuntimeException {

    private final boolean transientFailure;

    public EmailDeliveryException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
