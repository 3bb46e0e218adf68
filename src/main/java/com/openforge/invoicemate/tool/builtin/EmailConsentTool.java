package com.openforge.invoicemate.tool.builtin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.invoicemate.consent.ConsentGate;
import com.openforge.invoicemate.domain.PendingAction;
import com.openforge.invoicemate.email.EmailAttachment;
import com.openforge.invoicemate.email.EmailDraft;
import com.openforge.invoicemate.error.ValidationException;
import com.openforge.invoicemate.tool.ParameterType;
import com.openforge.invoicemate.tool.ToolInvocation;
import com.openforge.invoicemate.tool.ToolParameter;
import com.openforge.invoicemate.tool.ToolResult;
import com.openforge.invoicemate.tool.ToolSpec;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Freezes an email draft in the consent gate. Nothing is sent here: the user
 * approves the returned token in a separate request.
 */
@RequiredArgsConstructor
public class EmailConsentTool implements BuiltinTool {

    public static final String NAME = "request_user_email_consent";

    private static final ToolSpec SPEC = new ToolSpec(NAME,
            "Call this FIRST and ONLY ONCE when the user asks to send an email. It shows the user a preview "
                    + "of the email and asks for confirmation; the email is sent only after the user approves.",
            List.of(
                    ToolParameter.required("to_emails", ParameterType.STRING,
                            "One or more comma-separated recipient addresses, e.g. 'a@example.com,b@example.com'."),
                    ToolParameter.required("subject", ParameterType.STRING,
                            "The proposed subject line."),
                    ToolParameter.required("body", ParameterType.STRING,
                            "The proposed plain-text body. Use \\n for paragraphs; no HTML."),
                    ToolParameter.required("attachments_json", ParameterType.STRING,
                            "A JSON array of {\"url\": \"...\", \"filename\": \"...\"} objects for files issued in this "
                                    + "conversation. Use '[]' when there are no attachments.")));

    private final ConsentGate  consentGate;
    private final ObjectMapper objectMapper;

    @Override
    public ToolSpec spec() {
        return SPEC;
    }

    @Override
    public ToolResult execute(ToolInvocation invocation) {
        String subject = invocation.string("subject");
        if (subject == null || subject.isBlank()) {
            throw new ValidationException("The email subject must not be empty.");
        }
        EmailDraft draft = new EmailDraft(
                EmailDraft.parseRecipients(invocation.string("to_emails")),
                subject.trim(),
                invocation.string("body", ""),
                parseAttachments(invocation.string("attachments_json", "[]")));

        PendingAction action = consentGate.openDraft(
                invocation.conversationId(), PendingAction.ActionType.SEND_EMAIL, draft, NAME);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action_required", "consent");
        payload.put("action_token", action.getToken());
        payload.put("draft", draft);
        payload.put("expires_at", action.getExpiresAt().toString());
        return ToolResult.consentRequired(invocation.callId(), payload);
    }

    private List<EmailAttachment> parseAttachments(String json) {
        if (json.isBlank()) return List.of();
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ValidationException("attachments_json is not valid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isArray()) {
            throw new ValidationException("attachments_json must be a JSON array.");
        }
        List<EmailAttachment> attachments = new ArrayList<>();
        for (JsonNode node : root) {
            String url = node.path("url").asText("");
            if (url.isBlank()) {
                throw new ValidationException("Every attachment needs a 'url'.");
            }
            String filename = node.path("filename").asText("");
            if (filename.isBlank()) {
                filename = url.substring(url.lastIndexOf('/') + 1).split("\\?")[0];
            }
            attachments.add(new EmailAttachment(url, filename));
        }
        return attachments;
    }
}
