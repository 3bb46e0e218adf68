package com.openforge.invoicemate.error;

/** Unparseable use of the SIMILARITY pseudo-function. */
public class RewriteException extends InvoiceMateException {

    public RewriteException(String message) {
        super(ErrorKind.REWRITE_ERROR, message);
    }

    public RewriteException(String message, Throwable cause) {
        super(ErrorKind.REWRITE_ERROR, message, cause);
    }
}
