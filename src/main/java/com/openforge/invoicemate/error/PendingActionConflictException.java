package com.openforge.invoicemate.error;

/** A draft is already open for the conversation and must be resolved first. */
public class PendingActionConflictException extends InvoiceMateException {

    public PendingActionConflictException(String message) {
        super(ErrorKind.PENDING_ACTION_CONFLICT, message);
    }

    public PendingActionConflictException(String message, Throwable cause) {
        super(ErrorKind.PENDING_ACTION_CONFLICT, message, cause);
    }
}
