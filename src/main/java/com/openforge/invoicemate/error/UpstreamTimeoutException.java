package com.openforge.invoicemate.error;

/** A model, database or storage call did not answer within its bounded timeout. */
public class UpstreamTimeoutException extends InvoiceMateException {

    public UpstreamTimeoutException(String message) {
        super(ErrorKind.UPSTREAM_TIMEOUT, message);
    }

    public UpstreamTimeoutException(String message, Throwable cause) {
        super(ErrorKind.UPSTREAM_TIMEOUT, message, cause);
    }
}
