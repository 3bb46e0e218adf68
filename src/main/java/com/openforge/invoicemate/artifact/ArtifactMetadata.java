package com.openforge.invoicemate.artifact;

import java.util.List;

/**
 * Describes the file to issue.
 *
 * @param baseName      file name stem, sanitized before use
 * @param title         report title (PDF only)
 * @param columns       column order (CSV only); empty when unknown
 * @param expiryMinutes requested link lifetime, null for the default
 */
public record ArtifactMetadata(String baseName, String title, List<String> columns, Integer expiryMinutes) {

    public ArtifactMetadata {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public static ArtifactMetadata csv(String baseName, List<String> columns, Integer expiryMinutes) {
        return new ArtifactMetadata(baseName, null, columns, expiryMinutes);
    }

    public static ArtifactMetadata report(String baseName, String title, Integer expiryMinutes) {
        return new ArtifactMetadata(baseName, title, List.of(), expiryMinutes);
    }
}
