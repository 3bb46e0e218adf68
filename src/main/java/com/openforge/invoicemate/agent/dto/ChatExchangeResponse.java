package com.openforge.invoicemate.agent.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.invoicemate.llm.model.Message;

import java.util.List;

/**
 * Response body for POST /api/chat. The consent fields are present only
 * when {@code status} is CONSENT_REQUIRED.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record ChatExchangeResponse(

        @JsonProperty("conversationId") String        conversationId,
        @JsonProperty("status")         Status        status,
        @JsonProperty("answer")         String        answer,
        @JsonProperty("history")        List<Message> history,
        @JsonProperty("actionRequired") String        actionRequired,   // "consent"
        @JsonProperty("actionToken")    String        actionToken,
        @JsonProperty("draft")          Object        draft,
        @JsonProperty("expiresAt")      String        expiresAt,
        @JsonProperty("wsSubscribePath")String        wsSubscribePath
) {

    public enum Status { ANSWER, CONSENT_REQUIRED, ACTION_EXECUTED, ACTION_REJECTED, ROUND_LIMIT_EXCEEDED }

    public static ChatExchangeResponse of(String conversationId, Status status, String answer, List<Message> history) {
        return new ChatExchangeResponse(conversationId, status, answer, history,
                null, null, null, null, "/topic/agent/" + conversationId);
    }

    public static ChatExchangeResponse consent(String conversationId, String answer, List<Message> history,
                                               String actionToken, Object draft, String expiresAt) {
        return new ChatExchangeResponse(conversationId, Status.CONSENT_REQUIRED, answer, history,
                "consent", actionToken, draft, expiresAt, "/topic/agent/" + conversationId);
    }
}
