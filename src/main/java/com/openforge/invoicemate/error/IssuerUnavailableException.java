package com.openforge.invoicemate.error;

/** Artifact storage could not be reached after the bounded retry. */
public class IssuerUnavailableException extends InvoiceMateException {

    public IssuerUnavailableException(String message) {
        super(ErrorKind.ISSUER_UNAVAILABLE, message);
    }

    public IssuerUnavailableException(String message, Throwable cause) {
        super(ErrorKind.ISSUER_UNAVAILABLE, message, cause);
    }
}
