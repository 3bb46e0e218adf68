package com.openforge.invoicemate.artifact;

/**
 * Raised by an {@link ArtifactStorage} when the backing store rejects or
 * cannot be reached for an operation. Retried once by the issuer.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
