package com.openforge.invoicemate.error;

/** The action token was already executed (or is executing); a retry can never send twice. */
public class ActionAlreadyExecutedException extends InvoiceMateException {

    public ActionAlreadyExecutedException(String message) {
        super(ErrorKind.ACTION_ALREADY_EXECUTED, message);
    }

    public ActionAlreadyExecutedException(String message, Throwable cause) {
        super(ErrorKind.ACTION_ALREADY_EXECUTED, message, cause);
    }
}
