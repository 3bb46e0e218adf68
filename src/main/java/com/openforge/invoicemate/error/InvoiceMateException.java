package com.openforge.invoicemate.error;

/**
 * Root of the service's unchecked exception hierarchy.
 * Every subclass is bound to exactly one {@link ErrorKind}.
 */
public abstract class InvoiceMateException extends RuntimeException {

    private final ErrorKind kind;

    protected InvoiceMateException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected InvoiceMateException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
