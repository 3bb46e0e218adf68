package com.openforge.invoicemate.error;

/** Malformed tool arguments or a query the read-only guard refuses. */
public class ValidationException extends InvoiceMateException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION_ERROR, message, cause);
    }
}
