package com.openforge.invoicemate.email;

/**
 * Attachment bytes downloaded from an issued link.
 */
public record FetchedAttachment(String filename, String contentType, byte[] content) {
}
