package com.openforge.invoicemate.artifact;

import com.openforge.invoicemate.error.IssuerUnavailableException;
import com.openforge.invoicemate.sql.QueryResult;
import com.openforge.invoicemate.support.MutableClock;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ArtifactIssuerTest {

    private static final Instant NOW = Instant.parse("2024-03-02T10:15:30Z");

    private ArtifactStorage storage;
    private ArtifactIssuer issuer;

    @BeforeEach
    void setUp() throws Exception {
        storage = mock(ArtifactStorage.class);
        when(storage.presignGet(anyString(), any())).thenReturn(new URL("https://bucket.example.com/obj?X-Amz-Signature=abc"));

        Retry retry = Retry.of("artifactStorage", RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(StorageException.class)
                .build());
        ArtifactProperties properties = new ArtifactProperties("bucket", "/sessiondumps/", "us-east-1",
                null, null, null, false, 60, 1440, Duration.ofSeconds(20));
        issuer = new ArtifactIssuer(storage, new CsvArtifactWriter(), new PdfReportWriter(), retry, properties,
                new MutableClock(NOW));
    }

    // ==================== CSV ====================

    @Test
    void shouldStoreCsvUnderTimestampedKeyAndSignLink() {
        QueryResult result = new QueryResult(List.of("InvoiceID"), List.of(Map.of("InvoiceID", "INV-1")), false);

        IssuedArtifact artifact = issuer.issueCsv(result, "query_result", null);

        assertTrue(artifact.objectKey().matches("sessiondumps/20240302_101530_[0-9a-f]{12}_query_result\\.csv"),
                artifact.objectKey());
        assertEquals(artifact.objectKey(), "sessiondumps/" + artifact.filename());
        assertEquals("https://bucket.example.com/obj?X-Amz-Signature=abc", artifact.url());
        assertEquals(NOW.plus(Duration.ofMinutes(60)), artifact.expiresAt());

        ArgumentCaptor<byte[]> content = ArgumentCaptor.forClass(byte[].class);
        verify(storage).put(eq(artifact.objectKey()), content.capture(), eq("text/csv; charset=utf-8"));
        assertTrue(new String(content.getValue(), StandardCharsets.UTF_8).startsWith("InvoiceID\n"));
        verify(storage).presignGet(artifact.objectKey(), Duration.ofMinutes(60));
    }

    @Test
    void shouldGiveEachIssueADistinctKey() {
        QueryResult result = new QueryResult(List.of("InvoiceID"), List.of(), false);

        IssuedArtifact first = issuer.issueCsv(result, "query_result", null);
        IssuedArtifact second = issuer.issueCsv(result, "query_result", null);

        assertNotEquals(first.objectKey(), second.objectKey());
    }

    @Test
    void shouldIssueHeaderOnlyCsvForEmptyResult() {
        QueryResult empty = new QueryResult(List.of("InvoiceID", "Total"), List.of(), false);

        issuer.issueCsv(empty, "query_result", null);

        ArgumentCaptor<byte[]> content = ArgumentCaptor.forClass(byte[].class);
        verify(storage).put(anyString(), content.capture(), anyString());
        assertEquals("InvoiceID,Total", new String(content.getValue(), StandardCharsets.UTF_8).strip());
    }

    @Test
    void shouldSanitizeBaseName() {
        assertEquals("Verification_Report_INV_1001", ArtifactIssuer.sanitize("Verification Report/INV#1001"));
        assertEquals("artifact", ArtifactIssuer.sanitize(" ../ "));
        assertEquals(80, ArtifactIssuer.sanitize("x".repeat(200)).length());
    }

    // ==================== Expiry ====================

    @Test
    void shouldClampRequestedExpiry() {
        assertEquals(60, issuer.effectiveExpiryMinutes(null));
        assertEquals(15, issuer.effectiveExpiryMinutes(15));
        assertEquals(1, issuer.effectiveExpiryMinutes(0));
        assertEquals(1, issuer.effectiveExpiryMinutes(-30));
        assertEquals(1440, issuer.effectiveExpiryMinutes(100_000));
    }

    @Test
    void shouldUseClampedExpiryForLink() {
        IssuedArtifact artifact = issuer.issueCsv(new QueryResult(List.of("a"), List.of(), false), "x", 5000);

        assertEquals(NOW.plus(Duration.ofMinutes(1440)), artifact.expiresAt());
        verify(storage).presignGet(anyString(), eq(Duration.ofMinutes(1440)));
    }

    // ==================== PDF ====================

    @Test
    void shouldIssuePdfReport() {
        IssuedArtifact artifact = issuer.issueReport("Verification Report for Invoice: INV-1",
                List.of(new ReportSection("Summary", "- OK")), "Verification_Report_INV-1", 30);

        assertTrue(artifact.filename().endsWith("_Verification_Report_INV-1.pdf"));
        ArgumentCaptor<byte[]> content = ArgumentCaptor.forClass(byte[].class);
        verify(storage).put(anyString(), content.capture(), eq("application/pdf"));
        assertEquals("%PDF", new String(content.getValue(), 0, 4, StandardCharsets.US_ASCII));
    }

    // ==================== Storage failures ====================

    @Test
    void shouldRetryStorageOnce() {
        doThrow(new StorageException("timeout", null)).doNothing()
                .when(storage).put(anyString(), any(), anyString());

        IssuedArtifact artifact = issuer.issueCsv(new QueryResult(List.of("a"), List.of(), false), "x", null);

        assertNotNull(artifact.url());
        verify(storage, times(2)).put(anyString(), any(), anyString());
    }

    @Test
    void shouldFailAsUnavailableAfterSecondStorageFailure() {
        doThrow(new StorageException("down", null)).when(storage).put(anyString(), any(), anyString());

        QueryResult result = new QueryResult(List.of("a"), List.of(), false);
        IssuerUnavailableException ex = assertThrows(IssuerUnavailableException.class,
                () -> issuer.issueCsv(result, "x", null));

        assertTrue(ex.kind().retryable());
        verify(storage, times(2)).put(anyString(), any(), anyString());
        verify(storage, never()).presignGet(anyString(), any());
    }
}
