package com.openforge.invoicemate.artifact;

import java.net.URL;
import java.time.Duration;

/**
 * Private object store for issued files.
 */
public interface ArtifactStorage {

    /**
     * @throws StorageException if the object could not be written
     */
    void put(String key, byte[] content, String contentType);

    /**
     * A read-only link to exactly one object, valid for {@code validity}.
     *
     * @throws StorageException if the link could not be signed
     */
    URL presignGet(String key, Duration validity);
}
