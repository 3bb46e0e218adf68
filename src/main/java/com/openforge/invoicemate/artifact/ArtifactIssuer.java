package com.openforge.invoicemate.artifact;

import com.openforge.invoicemate.error.IssuerUnavailableException;
import com.openforge.invoicemate.sql.QueryResult;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.net.URL;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes result data into a file, stores it privately and hands back a
 * link that reads only that file and expires.
 *
 * Object keys: {@code <prefix>/<yyyyMMdd_HHmmss>_<12 hex>_<basename>.<ext>}.
 * Serialization failures are not retried; storage failures get exactly one
 * more attempt before {@link IssuerUnavailableException}.
 */
@Slf4j
@Service
public class ArtifactIssuer {

    private static final DateTimeFormatter KEY_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ArtifactStorage    storage;
    private final CsvArtifactWriter  csvWriter;
    private final PdfReportWriter    pdfWriter;
    private final Retry              artifactStorageRetry;
    private final ArtifactProperties properties;
    private final Clock              clock;
    private final SecureRandom       random = new SecureRandom();

    @Autowired
    public ArtifactIssuer(ArtifactStorage storage, Retry artifactStorageRetry, ArtifactProperties properties) {
        this(storage, new CsvArtifactWriter(), new PdfReportWriter(), artifactStorageRetry, properties, Clock.systemUTC());
    }

    ArtifactIssuer(ArtifactStorage storage,
                   CsvArtifactWriter csvWriter,
                   PdfReportWriter pdfWriter,
                   Retry artifactStorageRetry,
                   ArtifactProperties properties,
                   Clock clock) {
        this.storage              = storage;
        this.csvWriter            = csvWriter;
        this.pdfWriter            = pdfWriter;
        this.artifactStorageRetry = artifactStorageRetry;
        this.properties           = properties;
        this.clock                = clock;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * @param rows data rows for CSV; for PDF_REPORT, maps with
     *             {@code section_title} and {@code section_content}
     */
    public IssuedArtifact issue(ArtifactFormat format, List<Map<String, Object>> rows, ArtifactMetadata metadata) {
        byte[] content = switch (format) {
            case CSV -> csvWriter.write(metadata.columns(), rows);
            case PDF_REPORT -> pdfWriter.write(
                    metadata.title() == null ? "Report" : metadata.title(),
                    rows.stream().map(ArtifactIssuer::toSection).toList(),
                    LocalDateTime.now(clock));
        };
        return store(format, content, metadata);
    }

    public IssuedArtifact issueCsv(QueryResult result, String baseName, Integer expiryMinutes) {
        return issue(ArtifactFormat.CSV, result.rows(), ArtifactMetadata.csv(baseName, result.columns(), expiryMinutes));
    }

    public IssuedArtifact issueReport(String title, List<ReportSection> sections, String baseName, Integer expiryMinutes) {
        List<Map<String, Object>> rows = sections.stream().map(ArtifactIssuer::toRow).toList();
        return issue(ArtifactFormat.PDF_REPORT, rows, ArtifactMetadata.report(baseName, title, expiryMinutes));
    }

    /** Requested lifetime clamped to 1..max, default when absent. */
    public int effectiveExpiryMinutes(Integer requested) {
        if (requested == null) return properties.defaultExpiryMinutes();
        return Math.max(1, Math.min(requested, properties.maxExpiryMinutes()));
    }

    // ── Storage ──────────────────────────────────────────────────────────────

    private IssuedArtifact store(ArtifactFormat format, byte[] content, ArtifactMetadata metadata) {
        Instant now = clock.instant();
        String filename = "%s_%s_%s.%s".formatted(
                KEY_TIMESTAMP.format(now.atOffset(ZoneOffset.UTC)),
                randomHex(),
                sanitize(metadata.baseName()),
                format.extension());
        String key = objectKey(filename);
        int minutes = effectiveExpiryMinutes(metadata.expiryMinutes());
        Duration validity = Duration.ofMinutes(minutes);

        try {
            URL url = Retry.decorateSupplier(artifactStorageRetry, () -> {
                storage.put(key, content, format.contentType());
                return storage.presignGet(key, validity);
            }).get();
            log.info("[Issuer] Issued {} {} ({} bytes), link valid {} min", format, key, content.length, minutes);
            return new IssuedArtifact(url.toString(), filename, key, now.plus(validity));
        } catch (StorageException e) {
            log.warn("[Issuer] Storage failed for {}: {}", key, e.getMessage());
            throw new IssuerUnavailableException("The file could not be stored right now. Please try again.", e);
        }
    }

    private String objectKey(String filename) {
        String prefix = properties.prefix() == null ? "" : properties.prefix().replaceAll("^/+|/+$", "");
        return prefix.isEmpty() ? filename : prefix + "/" + filename;
    }

    private String randomHex() {
        byte[] bytes = new byte[6];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    static String sanitize(String baseName) {
        String cleaned = baseName == null ? "" : baseName.strip().replaceAll("[^A-Za-z0-9_-]+", "_");
        cleaned = cleaned.replaceAll("^_+|_+$", "");
        if (cleaned.isEmpty()) cleaned = "artifact";
        return cleaned.length() > 80 ? cleaned.substring(0, 80) : cleaned;
    }

    private static ReportSection toSection(Map<String, Object> row) {
        Object title = row.get("section_title");
        Object content = row.get("section_content");
        return new ReportSection(title == null ? "" : title.toString(), content == null ? "" : content.toString());
    }

    private static Map<String, Object> toRow(ReportSection section) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("section_title", section.sectionTitle());
        row.put("section_content", section.sectionContent());
        return row;
    }
}
