package com.openforge.invoicemate.error;

/** No open draft matches the supplied token for this conversation. */
public class NoPendingActionException extends InvoiceMateException {

    public NoPendingActionException(String message) {
        super(ErrorKind.NO_PENDING_ACTION, message);
    }

    public NoPendingActionException(String message, Throwable cause) {
        super(ErrorKind.NO_PENDING_ACTION, message, cause);
    }
}
