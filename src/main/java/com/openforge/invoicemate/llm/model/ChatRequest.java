package com.openforge.invoicemate.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * The request body sent to an OpenAI-compatible /chat/completions endpoint.
 *
 * toolChoice is always "auto" for the invoice agent: the model decides
 * between answering and calling one of the registered tools.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        List<Tool> tools,
        String toolChoice,
        Double temperature,
        Integer maxTokens
) {

    public static ChatRequest withTools(List<Message> messages, List<Tool> tools, double temperature) {
        return ChatRequest.builder()
                .messages(messages)
                .tools(tools == null || tools.isEmpty() ? null : tools)
                .toolChoice(tools == null || tools.isEmpty() ? null : "auto")
                .temperature(temperature)
                .maxTokens(4096)
                .build();
    }
}
