package com.openforge.invoicemate.artifact;

import java.time.Instant;

/**
 * A stored file and the time-boxed link that reads it.
 */
public record IssuedArtifact(String url, String filename, String objectKey, Instant expiresAt) {
}
