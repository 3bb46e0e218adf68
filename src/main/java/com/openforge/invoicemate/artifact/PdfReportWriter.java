package com.openforge.invoicemate.artifact;

import com.openforge.invoicemate.error.SerializationException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a verification report: a title, then one block per section, with
 * a "Generated on" timestamp and page numbers in every footer.
 */
public class PdfReportWriter {

    private static final float MARGIN        = 50f;
    private static final float TITLE_SIZE    = 16f;
    private static final float HEADING_SIZE  = 12f;
    private static final float BODY_SIZE     = 10f;
    private static final float FOOTER_SIZE   = 8f;
    private static final float LEADING       = 1.4f;
    private static final float BULLET_INDENT = 12f;

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final PDType1Font regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
    private final PDType1Font bold    = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);

    public byte[] write(String title, List<ReportSection> sections, LocalDateTime generatedAt) {
        try (PDDocument doc = new PDDocument()) {
            Cursor cursor = new Cursor(doc);
            try {
                cursor.paragraph(title, bold, TITLE_SIZE, 0f);
                cursor.gap(TITLE_SIZE);
                for (ReportSection section : sections) {
                    cursor.paragraph(nullToEmpty(section.sectionTitle()), bold, HEADING_SIZE, 0f);
                    cursor.gap(HEADING_SIZE * 0.4f);
                    for (String line : nullToEmpty(section.sectionContent()).split("\\R", -1)) {
                        String trimmed = line.strip();
                        if (trimmed.startsWith("- ") || trimmed.startsWith("* ")) {
                            cursor.paragraph("-  " + trimmed.substring(2).strip(), regular, BODY_SIZE,
                                    BULLET_INDENT * (1 + indentLevel(line)));
                        } else if (trimmed.isEmpty()) {
                            cursor.gap(BODY_SIZE * 0.6f);
                        } else {
                            cursor.paragraph(trimmed, regular, BODY_SIZE, 0f);
                        }
                    }
                    cursor.gap(BODY_SIZE * 1.5f);
                }
            } finally {
                cursor.close();
            }
            writeFooters(doc, "Generated on: " + TIMESTAMP.format(generatedAt));

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            return out.toByteArray();
        } catch (IOException | IllegalArgumentException e) {
            throw new SerializationException("Failed to render PDF report: " + e.getMessage(), e);
        }
    }

    private void writeFooters(PDDocument doc, String generatedOn) throws IOException {
        int total = doc.getNumberOfPages();
        for (int i = 0; i < total; i++) {
            PDPage page = doc.getPage(i);
            try (PDPageContentStream cs = new PDPageContentStream(doc, page,
                    PDPageContentStream.AppendMode.APPEND, true, true)) {
                String pageLabel = "Page %d of %d".formatted(i + 1, total);
                float pageWidth = page.getMediaBox().getWidth();
                cs.beginText();
                cs.setFont(regular, FOOTER_SIZE);
                cs.newLineAtOffset(MARGIN, MARGIN / 2);
                cs.showText(generatedOn);
                cs.endText();
                cs.beginText();
                cs.setFont(regular, FOOTER_SIZE);
                cs.newLineAtOffset(pageWidth - MARGIN - width(regular, FOOTER_SIZE, pageLabel), MARGIN / 2);
                cs.showText(pageLabel);
                cs.endText();
            }
        }
    }

    private static int indentLevel(String line) {
        int spaces = 0;
        while (spaces < line.length() && line.charAt(spaces) == ' ') spaces++;
        return Math.min(spaces / 2, 3);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    static float width(PDType1Font font, float size, String text) throws IOException {
        return font.getStringWidth(text) / 1000f * size;
    }

    /** Keeps only characters the standard 14 fonts can encode. */
    static String printable(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\t') sb.append("    ");
            else if (c == '•') sb.append('-');
            else if (c == '‘' || c == '’') sb.append('\'');
            else if (c == '“' || c == '”') sb.append('"');
            else if (c == '\u2013' || c == '\u2014') sb.append('-');
            else if ((c >= 0x20 && c <= 0x7E) || (c >= 0xA0 && c <= 0xFF)) sb.append(c);
            else sb.append('?');
        }
        return sb.toString();
    }

    // ── Page cursor ──────────────────────────────────────────────────────────

    /** Tracks the write position and opens a new page when the current one is full. */
    private final class Cursor {

        private final PDDocument doc;
        private PDPageContentStream stream;
        private float y;
        private final float width = PDRectangle.A4.getWidth() - 2 * MARGIN;

        Cursor(PDDocument doc) throws IOException {
            this.doc = doc;
            newPage();
        }

        void paragraph(String text, PDType1Font font, float size, float indent) throws IOException {
            for (String line : wrap(printable(text), font, size, width - indent)) {
                float lineHeight = size * LEADING;
                if (y - lineHeight < MARGIN) newPage();
                y -= lineHeight;
                stream.beginText();
                stream.setFont(font, size);
                stream.newLineAtOffset(MARGIN + indent, y);
                stream.showText(line);
                stream.endText();
            }
        }

        void gap(float height) {
            y -= height;
        }

        void close() throws IOException {
            if (stream != null) {
                stream.close();
                stream = null;
            }
        }

        private void newPage() throws IOException {
            close();
            PDPage page = new PDPage(PDRectangle.A4);
            doc.addPage(page);
            stream = new PDPageContentStream(doc, page);
            y = page.getMediaBox().getHeight() - MARGIN;
        }

        private List<String> wrap(String text, PDType1Font font, float size, float maxWidth) throws IOException {
            List<String> lines = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            for (String word : text.split(" ")) {
                String candidate = current.isEmpty() ? word : current + " " + word;
                if (width(font, size, candidate) <= maxWidth) {
                    current.setLength(0);
                    current.append(candidate);
                    continue;
                }
                if (!current.isEmpty()) {
                    lines.add(current.toString());
                    current.setLength(0);
                }
                // a single word wider than the line is hard-split
                while (width(font, size, word) > maxWidth && word.length() > 1) {
                    int cut = word.length() - 1;
                    while (cut > 1 && width(font, size, word.substring(0, cut)) > maxWidth) cut--;
                    lines.add(word.substring(0, cut));
                    word = word.substring(cut);
                }
                current.append(word);
            }
            if (!current.isEmpty() || lines.isEmpty()) {
                lines.add(current.toString());
            }
            return lines;
        }
    }
}
