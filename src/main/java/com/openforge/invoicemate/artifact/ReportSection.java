package com.openforge.invoicemate.artifact;

/**
 * One titled block of a verification report. Content is plain text; newlines
 * start new lines and lines starting with "-" render as bullets.
 */
public record ReportSection(String sectionTitle, String sectionContent) {
}
