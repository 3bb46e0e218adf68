package com.openforge.invoicemate.agent;

import com.openforge.invoicemate.agent.dto.ChatExchangeRequest;
import com.openforge.invoicemate.agent.dto.ChatExchangeResponse;
import com.openforge.invoicemate.consent.ConsentGate;
import com.openforge.invoicemate.domain.PendingAction;
import com.openforge.invoicemate.error.ValidationException;
import com.openforge.invoicemate.llm.model.Message;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * One chat request: either a new user message run through the orchestrator,
 * or the user's decision on a pending action.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatService {

    private final AgentOrchestrator orchestrator;
    private final ConsentGate       consentGate;
    private final AgentProperties   properties;

    public ChatExchangeResponse exchange(ChatExchangeRequest request) {
        String conversationId = request.conversationId() != null && !request.conversationId().isBlank()
                ? request.conversationId()
                : UUID.randomUUID().toString();
        Conversation conversation = restore(conversationId, request);

        if (request.isDecision()) {
            return decide(conversation, request);
        }
        if (request.message() == null || request.message().isBlank()) {
            throw new ValidationException("A message, or a pending action token with a decision, is required.");
        }
        consentGate.assertNoOpenDraft(conversationId);

        ExchangeOutcome outcome = orchestrator.run(conversation, request.message(), properties.maxRounds());
        return switch (outcome.status()) {
            case ANSWER -> ChatExchangeResponse.of(conversationId,
                    ChatExchangeResponse.Status.ANSWER, outcome.answer(), conversation.transcript());
            case ROUND_LIMIT_EXCEEDED -> ChatExchangeResponse.of(conversationId,
                    ChatExchangeResponse.Status.ROUND_LIMIT_EXCEEDED, outcome.answer(), conversation.transcript());
            case CONSENT_REQUIRED -> consentResponse(conversation, outcome.consentPayload());
        };
    }

    // ── Decisions ────────────────────────────────────────────────────────────

    private ChatExchangeResponse decide(Conversation conversation, ChatExchangeRequest request) {
        String conversationId = conversation.id();
        String token = request.pendingActionToken();
        log.info("[API] {} of action {} in conversation {}", request.decision(), token, conversationId);

        if (request.decision() == ChatExchangeRequest.Decision.APPROVE) {
            PendingAction executed = consentGate.approve(conversationId, token);
            String answer = executed.getResultSummary() + ".";
            conversation.append(Message.assistantText(answer));
            return ChatExchangeResponse.of(conversationId,
                    ChatExchangeResponse.Status.ACTION_EXECUTED, answer, conversation.transcript());
        }

        consentGate.reject(conversationId, token);
        String answer = "The action was cancelled; nothing was sent.";
        conversation.append(Message.assistantText(answer));
        return ChatExchangeResponse.of(conversationId,
                ChatExchangeResponse.Status.ACTION_REJECTED, answer, conversation.transcript());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private Conversation restore(String conversationId, ChatExchangeRequest request) {
        if (request.history() != null
                && request.history().stream().anyMatch(t -> t != null && Message.ROLE_SYSTEM.equals(t.role()))) {
            throw new ValidationException("Invalid conversation history: system turns are not accepted.");
        }
        try {
            return Conversation.of(conversationId, request.history());
        } catch (IllegalStateException e) {
            throw new ValidationException("Invalid conversation history: " + e.getMessage());
        }
    }

    private ChatExchangeResponse consentResponse(Conversation conversation, Map<String, Object> payload) {
        String token = String.valueOf(payload.get("action_token"));
        Object expiresAt = payload.get("expires_at");
        return ChatExchangeResponse.consent(
                conversation.id(),
                "Please review the draft below and approve or reject it.",
                conversation.transcript(),
                token,
                payload.get("draft"),
                expiresAt == null ? null : expiresAt.toString());
    }
}
