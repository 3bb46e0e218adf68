package com.openforge.invoicemate.artifact;

/**
 * File formats the issuer can produce.
 */
public enum ArtifactFormat {

    CSV("csv", "text/csv; charset=utf-8"),
    PDF_REPORT("pdf", "application/pdf");

    private final String extension;
    private final String contentType;

    ArtifactFormat(String extension, String contentType) {
        this.extension = extension;
        this.contentType = contentType;
    }

    public String extension() {
        return extension;
    }

    public String contentType() {
        return contentType;
    }
}
