package com.openforge.invoicemate.llm.model;

/**
 * A single tool invocation request produced by the LLM.
 *
 * The id is opaque and model-issued; the matching tool-result turn must
 * carry the same value in tool_call_id.
 */
public record ToolCall(
        String id,
        String type,
        FunctionCallResult function
) {

    public static ToolCall of(String id, String name, String argumentsJson) {
        return new ToolCall(id, "function", new FunctionCallResult(name, argumentsJson));
    }

    public String name() {
        return function == null ? null : function.name();
    }

    public String arguments() {
        return function == null ? null : function.arguments();
    }
}
