package com.openforge.invoicemate.error;

/** Row data could not be rendered into the requested artifact format. Not retryable. */
public class SerializationException extends InvoiceMateException {

    public SerializationException(String message) {
        super(ErrorKind.SERIALIZATION_ERROR, message);
    }

    public SerializationException(String message, Throwable cause) {
        super(ErrorKind.SERIALIZATION_ERROR, message, cause);
    }
}
