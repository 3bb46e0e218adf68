package com.openforge.invoicemate.agent.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.invoicemate.llm.model.Message;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request body for POST /api/chat.
 *
 * Either {@code message} (a new user turn) or {@code pendingActionToken}
 * together with {@code decision} (answer to a consent request) is required.
 * History turns keep the model's wire format (tool_calls, tool_call_id).
 *
 * @param conversationId optional; if blank the server generates a UUID
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record ChatExchangeRequest(

        @JsonProperty("conversationId")     String        conversationId,

        @Size(max = 8000, message = "message must not exceed 8000 characters")
        @JsonProperty("message")            String        message,

        @JsonProperty("history")            List<Message> history,
        @JsonProperty("pendingActionToken") String        pendingActionToken,
        @JsonProperty("decision")           Decision      decision
) {

    public enum Decision { APPROVE, REJECT }

    public boolean isDecision() {
        return pendingActionToken != null && !pendingActionToken.isBlank() && decision != null;
    }
}
