package com.openforge.invoicemate.tool.builtin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.invoicemate.artifact.ArtifactIssuer;
import com.openforge.invoicemate.artifact.IssuedArtifact;
import com.openforge.invoicemate.artifact.ReportSection;
import com.openforge.invoicemate.error.ValidationException;
import com.openforge.invoicemate.tool.ParameterType;
import com.openforge.invoicemate.tool.ToolInvocation;
import com.openforge.invoicemate.tool.ToolParameter;
import com.openforge.invoicemate.tool.ToolResult;
import com.openforge.invoicemate.tool.ToolSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders the model's invoice verification findings as a PDF report.
 */
@Slf4j
@RequiredArgsConstructor
public class VerificationReportTool implements BuiltinTool {

    public static final String NAME = "generate_verification_report_pdf_tool";

    private static final ToolSpec SPEC = new ToolSpec(NAME,
            "Generate a PDF verification report for an invoice and return a short-lived download link: "
                    + "{pdf_url, filename, expires_at}. The report cannot render tables; put findings into "
                    + "plain text with '- ' bullet lines.",
            List.of(
                    ToolParameter.required("verification_data_json", ParameterType.STRING,
                            "A JSON array of sections, each {\"section_title\": \"...\", \"section_content\": \"...\"}. "
                                    + "Use \\n for new lines and '- ' for bullet points."),
                    ToolParameter.required("invoice_id", ParameterType.STRING,
                            "The InvoiceID the report is about."),
                    ToolParameter.optional("expiry_minutes", ParameterType.INTEGER,
                            "How many minutes the download link stays valid. Default is 60.")));

    private final ArtifactIssuer issuer;
    private final ObjectMapper   objectMapper;

    @Override
    public ToolSpec spec() {
        return SPEC;
    }

    @Override
    public ToolResult execute(ToolInvocation invocation) {
        String invoiceId = invocation.string("invoice_id").trim();
        List<ReportSection> sections = parseSections(invocation.string("verification_data_json"));

        IssuedArtifact artifact = issuer.issueReport(
                "Verification Report for Invoice: " + invoiceId,
                sections,
                "Verification_Report_" + invoiceId,
                invocation.integer("expiry_minutes"));
        log.info("[Issuer] Verification report for invoice {} issued as {}", invoiceId, artifact.filename());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("pdf_url", artifact.url());
        payload.put("filename", artifact.filename());
        payload.put("expires_at", artifact.expiresAt().toString());
        return ToolResult.success(invocation.callId(), payload);
    }

    private List<ReportSection> parseSections(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ValidationException("verification_data_json is not valid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isArray()) {
            throw new ValidationException("verification_data_json must be a JSON array of sections.");
        }
        List<ReportSection> sections = new ArrayList<>();
        for (JsonNode node : root) {
            if (!node.isObject()) {
                throw new ValidationException("Each report section must be an object with section_title and section_content.");
            }
            sections.add(new ReportSection(
                    node.path("section_title").asText("Untitled Section"),
                    node.path("section_content").asText("")));
        }
        return sections;
    }
}
