package com.openforge.invoicemate.email;

/**
 * An attachment reference in a draft: a link previously issued by the
 * artifact issuer plus the file name to present to recipients.
 */
public record EmailAttachment(String url, String filename) {
}
