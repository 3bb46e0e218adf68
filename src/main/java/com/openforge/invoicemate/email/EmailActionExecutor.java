package com.openforge.invoicemate.email;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.invoicemate.consent.SensitiveActionExecutor;
import com.openforge.invoicemate.domain.PendingAction;
import com.openforge.invoicemate.error.ExecutionFailedException;
import com.openforge.invoicemate.error.SerializationException;
import com.openforge.invoicemate.error.UpstreamUnavailableException;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Sends an approved email draft. Only reached through the consent gate.
 */
@Slf4j
@Component
public class EmailActionExecutor implements SensitiveActionExecutor {

    private final EmailSender       sender;
    private final AttachmentFetcher attachmentFetcher;
    private final Retry             retry;
    private final ObjectMapper      objectMapper;

    public EmailActionExecutor(EmailSender sender,
                               AttachmentFetcher attachmentFetcher,
                               Retry emailDeliveryRetry,
                               ObjectMapper objectMapper) {
        this.sender            = sender;
        this.attachmentFetcher = attachmentFetcher;
        this.retry             = emailDeliveryRetry;
        this.objectMapper      = objectMapper;
    }

    @Override
    public PendingAction.ActionType actionType() {
        return PendingAction.ActionType.SEND_EMAIL;
    }

    @Override
    public String execute(PendingAction action) {
        EmailDraft draft = readDraft(action);
        AttachmentFetcher.FetchOutcome fetched = attachmentFetcher.fetchAll(draft.attachments());

        try {
            Retry.decorateRunnable(retry, () -> sender.send(draft, fetched.attachments())).run();
        } catch (EmailDeliveryException e) {
            if (e.isTransient()) {
                throw new UpstreamUnavailableException("Email could not be delivered: " + e.getMessage(), e);
            }
            throw new ExecutionFailedException(e.getMessage(), e);
        }

        StringBuilder summary = new StringBuilder("Email sent to ")
                .append(String.join(", ", draft.toEmails()));
        if (!fetched.attachments().isEmpty()) {
            summary.append(" with ").append(fetched.attachments().size()).append(" attachment(s)");
        }
        if (!fetched.failures().isEmpty()) {
            summary.append(". Skipped attachments: ").append(String.join("; ", fetched.failures()));
        }
        log.info("[Email] Action {} delivered", action.getToken());
        return summary.toString();
    }

    private EmailDraft readDraft(PendingAction action) {
        try {
            return objectMapper.readValue(action.getDraftJson(), EmailDraft.class);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Stored email draft " + action.getToken() + " could not be read.", e);
        }
    }
}
