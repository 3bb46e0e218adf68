package com.openforge.invoicemate.llm.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Entry of the request's "tools" array:
 * {"type": "function", "function": {"name", "description", "parameters"}}.
 */
public record Tool(String type, ToolFunction function) {

    public static final String FUNCTION = "function";

    public static Tool function(String name, String description, JsonNode parameters) {
        return new Tool(FUNCTION, new ToolFunction(name, description, parameters));
    }
}
