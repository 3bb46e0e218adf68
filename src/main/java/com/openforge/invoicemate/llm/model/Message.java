package com.openforge.invoicemate.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * A single turn in the conversation sent to the LLM.
 *
 * role variants:
 *   "system"     static instructions for the invoice agent
 *   "user"       human turn
 *   "assistant"  model reply; may contain tool_calls instead of content
 *   "tool"       result returned after executing a tool call
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        String role,

        /** Text content. Null for assistant messages that only contain tool_calls. */
        String content,

        /** Present only in assistant messages that request tool calls. */
        List<ToolCall> toolCalls,

        /** Present only in tool-result messages; matches the id of the answered ToolCall. */
        String toolCallId,

        /** Tool name on tool-result messages. */
        String name
) {

    public static final String ROLE_SYSTEM    = "system";
    public static final String ROLE_USER      = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL      = "tool";

    public static Message system(String content) {
        return Message.builder().role(ROLE_SYSTEM).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(ROLE_USER).content(content).build();
    }

    public static Message assistantText(String content) {
        return Message.builder().role(ROLE_ASSISTANT).content(content).build();
    }

    public static Message toolResult(String toolCallId, String toolName, String result) {
        return Message.builder().role(ROLE_TOOL).toolCallId(toolCallId).name(toolName).content(result).build();
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
