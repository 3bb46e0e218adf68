package com.openforge.invoicemate.error;

/** A tool ran but its backing operation failed (e.g. the database rejected the query). */
public class ExecutionFailedException extends InvoiceMateException {

    public ExecutionFailedException(String message) {
        super(ErrorKind.EXECUTION_FAILED, message);
    }

    public ExecutionFailedException(String message, Throwable cause) {
        super(ErrorKind.EXECUTION_FAILED, message, cause);
    }
}
