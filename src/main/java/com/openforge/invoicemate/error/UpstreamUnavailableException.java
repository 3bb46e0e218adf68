package com.openforge.invoicemate.error;

/** A network collaborator (LLM provider, mail server) failed transiently. */
public class UpstreamUnavailableException extends InvoiceMateException {

    public UpstreamUnavailableException(String message) {
        super(ErrorKind.UPSTREAM_UNAVAILABLE, message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(ErrorKind.UPSTREAM_UNAVAILABLE, message, cause);
    }
}
