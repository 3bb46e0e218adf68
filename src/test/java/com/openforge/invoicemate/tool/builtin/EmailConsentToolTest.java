package com.openforge.invoicemate.tool.builtin;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.invoicemate.consent.ConsentGate;
import com.openforge.invoicemate.domain.PendingAction;
import com.openforge.invoicemate.domain.PendingAction.ActionType;
import com.openforge.invoicemate.email.EmailAttachment;
import com.openforge.invoicemate.email.EmailDraft;
import com.openforge.invoicemate.error.ValidationException;
import com.openforge.invoicemate.tool.ToolInvocation;
import com.openforge.invoicemate.tool.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class EmailConsentToolTest {

    private static final String CONVERSATION = "conv-1";
    private static final Instant EXPIRES = Instant.parse("2024-03-02T10:30:00Z");

    private ConsentGate consentGate;
    private EmailConsentTool tool;

    @BeforeEach
    void setUp() {
        consentGate = mock(ConsentGate.class);
        tool = new EmailConsentTool(consentGate, new ObjectMapper());
        when(consentGate.openDraft(eq(CONVERSATION), eq(ActionType.SEND_EMAIL), any(), eq(EmailConsentTool.NAME)))
                .thenReturn(PendingAction.builder().token("tok-1").conversationId(CONVERSATION)
                        .actionType(ActionType.SEND_EMAIL).expiresAt(EXPIRES).draftJson("{}").build());
    }

    @Test
    void shouldOpenDraftAndRequireConsent() {
        ToolResult result = tool.execute(invocation(Map.of(
                "to_emails", "ap@example.com; lead@example.com",
                "subject", "  Invoice INV-1001  ",
                "body", "Please see attached.",
                "attachments_json", "[{\"url\": \"https://files.example.com/dumps/report.pdf?sig=abc\"}]")));

        assertTrue(result.requiresConsent());
        assertEquals("consent", result.payload().get("action_required"));
        assertEquals("tok-1", result.payload().get("action_token"));
        assertEquals("2024-03-02T10:30:00Z", result.payload().get("expires_at"));

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(consentGate).openDraft(eq(CONVERSATION), eq(ActionType.SEND_EMAIL), captor.capture(), eq(EmailConsentTool.NAME));
        EmailDraft draft = (EmailDraft) captor.getValue();
        assertEquals(List.of("ap@example.com", "lead@example.com"), draft.toEmails());
        assertEquals("Invoice INV-1001", draft.subject());
        assertEquals(List.of(new EmailAttachment("https://files.example.com/dumps/report.pdf?sig=abc", "report.pdf")),
                draft.attachments());
        assertSame(draft, result.payload().get("draft"));
    }

    @Test
    void shouldKeepExplicitAttachmentFilename() {
        tool.execute(invocation(Map.of(
                "to_emails", "ap@example.com",
                "subject", "Export",
                "body", "",
                "attachments_json", "[{\"url\": \"https://x.example.com/a.csv\", \"filename\": \"invoices.csv\"}]")));

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(consentGate).openDraft(any(), any(), captor.capture(), any());
        assertEquals("invoices.csv", ((EmailDraft) captor.getValue()).attachments().get(0).filename());
    }

    @Test
    void shouldRejectInvalidRecipientWithoutOpeningDraft() {
        assertThrows(ValidationException.class, () -> tool.execute(invocation(Map.of(
                "to_emails", "not-an-address",
                "subject", "Hi",
                "body", "",
                "attachments_json", "[]"))));

        verifyNoInteractions(consentGate);
    }

    @Test
    void shouldRejectBlankSubject() {
        assertThrows(ValidationException.class, () -> tool.execute(invocation(Map.of(
                "to_emails", "ap@example.com",
                "subject", "   ",
                "body", "",
                "attachments_json", "[]"))));
    }

    @Test
    void shouldRejectMalformedAttachments() {
        assertThrows(ValidationException.class, () -> tool.execute(invocation(Map.of(
                "to_emails", "ap@example.com", "subject", "Hi", "body", "",
                "attachments_json", "{\"url\": \"x\"}"))));
        assertThrows(ValidationException.class, () -> tool.execute(invocation(Map.of(
                "to_emails", "ap@example.com", "subject", "Hi", "body", "",
                "attachments_json", "[{\"filename\": \"a.csv\"}]"))));
        assertThrows(ValidationException.class, () -> tool.execute(invocation(Map.of(
                "to_emails", "ap@example.com", "subject", "Hi", "body", "",
                "attachments_json", "[{"))));

        verifyNoInteractions(consentGate);
    }

    private static ToolInvocation invocation(Map<String, Object> args) {
        return new ToolInvocation("call-1", CONVERSATION, args);
    }
}
