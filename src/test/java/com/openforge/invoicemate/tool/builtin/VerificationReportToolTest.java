package com.openforge.invoicemate.tool.builtin;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.invoicemate.artifact.ArtifactIssuer;
import com.openforge.invoicemate.artifact.IssuedArtifact;
import com.openforge.invoicemate.artifact.ReportSection;
import com.openforge.invoicemate.error.ValidationException;
import com.openforge.invoicemate.tool.ToolInvocation;
import com.openforge.invoicemate.tool.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class VerificationReportToolTest {

    private ArtifactIssuer issuer;
    private VerificationReportTool tool;

    @BeforeEach
    void setUp() {
        issuer = mock(ArtifactIssuer.class);
        tool = new VerificationReportTool(issuer, new ObjectMapper());
    }

    @Test
    void shouldIssueReportFromSections() {
        when(issuer.issueReport(anyString(), any(), anyString(), any())).thenReturn(new IssuedArtifact(
                "https://bucket.example.com/r.pdf?sig=1", "Verification_Report_INV-1001.pdf",
                "sessiondumps/r.pdf", Instant.parse("2024-03-02T11:00:00Z")));

        ToolResult result = tool.execute(new ToolInvocation("call-1", "conv-1", Map.of(
                "invoice_id", " INV-1001 ",
                "verification_data_json", "[{\"section_title\": \"Summary\", \"section_content\": \"- Total matches PO\"},"
                        + " {\"section_content\": \"No contract found\"}]",
                "expiry_minutes", 30)));

        verify(issuer).issueReport(
                "Verification Report for Invoice: INV-1001",
                List.of(new ReportSection("Summary", "- Total matches PO"),
                        new ReportSection("Untitled Section", "No contract found")),
                "Verification_Report_INV-1001",
                30);
        assertTrue(result.success());
        assertEquals("https://bucket.example.com/r.pdf?sig=1", result.payload().get("pdf_url"));
        assertEquals("Verification_Report_INV-1001.pdf", result.payload().get("filename"));
        assertEquals("2024-03-02T11:00:00Z", result.payload().get("expires_at"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"not json", "{\"section_title\": \"x\"}", "[\"just text\"]"})
    void shouldRejectMalformedSections(String json) {
        ToolInvocation invocation = new ToolInvocation("call-1", "conv-1",
                Map.of("invoice_id", "INV-1", "verification_data_json", json));

        assertThrows(ValidationException.class, () -> tool.execute(invocation));
        verifyNoInteractions(issuer);
    }
}
