package com.openforge.invoicemate.llm.model;

import java.util.List;
import java.util.Optional;

/**
 * Non-streaming /chat/completions response. Only the first choice is read:
 * requests never ask for n > 1.
 */
public record ChatResponse(
        String id,
        String object,
        Long created,
        String model,
        List<Choice> choices,
        Usage usage
) {

    /** The assistant turn of the first choice, empty when the provider sent none. */
    public Optional<Message> assistantMessage() {
        if (choices == null || choices.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(choices.get(0).message());
    }

    /** "stop", "tool_calls", "length", ... or null when absent. */
    public String finishReason() {
        return choices == null || choices.isEmpty() ? null : choices.get(0).finishReason();
    }

    public record Choice(int index, Message message, String finishReason) {}

    public record Usage(int promptTokens, int completionTokens, int totalTokens) {}
}
