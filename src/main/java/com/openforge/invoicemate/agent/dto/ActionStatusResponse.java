package com.openforge.invoicemate.agent.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.invoicemate.domain.PendingAction;

import java.time.Instant;

/**
 * Response body for GET /api/chat/actions/{token}. Carries no draft content.
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record ActionStatusResponse(

        @JsonProperty("token")          String  token,
        @JsonProperty("conversationId") String  conversationId,
        @JsonProperty("actionType")     String  actionType,
        @JsonProperty("status")         String  status,
        @JsonProperty("expiresAt")      Instant expiresAt,
        @JsonProperty("executedAt")     Instant executedAt,
        @JsonProperty("resultSummary")  String  resultSummary,
        @JsonProperty("lastError")      String  lastError
) {

    public static ActionStatusResponse from(PendingAction action) {
        return new ActionStatusResponse(
                action.getToken(),
                action.getConversationId(),
                action.getActionType().name(),
                action.getStatus().name(),
                action.getExpiresAt(),
                action.getExecutedAt(),
                action.getResultSummary(),
                action.getLastError()
        );
    }
}
