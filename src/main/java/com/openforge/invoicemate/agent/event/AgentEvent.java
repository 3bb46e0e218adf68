package com.openforge.invoicemate.agent.event;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The single event envelope broadcast over WebSocket.
 *
 * Fields:
 *   conversationId  the conversation this event belongs to
 *   type            discriminator; tells the frontend how to render the event
 *   content         free-form text (answer for FINAL_ANSWER, message for ERROR)
 *   payload         structured object for TOOL_CALL, TOOL_RESULT and CONSENT_REQUIRED
 *   round           which model round produced this event
 *   timestamp       epoch millis
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentEvent(
        String    conversationId,
        EventType type,
        String    content,
        Object    payload,
        int       round,
        long      timestamp
) {

    // ── Static factory helpers ───────────────────────────────────────────────

    public static AgentEvent roundStart(String conversationId, int round) {
        return new AgentEvent(conversationId, EventType.ROUND_START, null, null, round, now());
    }

    public static AgentEvent toolCall(String conversationId, Object toolCallPayload, int round) {
        return new AgentEvent(conversationId, EventType.TOOL_CALL, null, toolCallPayload, round, now());
    }

    public static AgentEvent toolResult(String conversationId, String toolName, boolean success, String output, int round) {
        return new AgentEvent(conversationId, EventType.TOOL_RESULT, output,
                new ToolResultPayload(toolName, success, output), round, now());
    }

    public static AgentEvent finalAnswer(String conversationId, String answer, int round) {
        return new AgentEvent(conversationId, EventType.FINAL_ANSWER, answer, null, round, now());
    }

    public static AgentEvent consentRequired(String conversationId, Object draftPayload, int round) {
        return new AgentEvent(conversationId, EventType.CONSENT_REQUIRED, null, draftPayload, round, now());
    }

    public static AgentEvent error(String conversationId, String message, int round) {
        return new AgentEvent(conversationId, EventType.ERROR, message, null, round, now());
    }

    private static long now() {
        return System.currentTimeMillis();
    }

    // ── Nested payload types ─────────────────────────────────────────────────

    public record ToolResultPayload(String toolName, boolean success, String output) {}
}
