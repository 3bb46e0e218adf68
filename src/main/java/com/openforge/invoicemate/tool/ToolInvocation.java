package com.openforge.invoicemate.tool;

import java.util.Map;

/**
 * Validated arguments of one tool call, plus the conversation it belongs to.
 */
public record ToolInvocation(String callId, String conversationId, Map<String, Object> arguments) {

    public ToolInvocation {
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    public String string(String name) {
        Object value = arguments.get(name);
        return value == null ? null : value.toString();
    }

    public String string(String name, String defaultValue) {
        String value = string(name);
        return value == null ? defaultValue : value;
    }

    /** Integer argument, or null when absent. */
    public Integer integer(String name) {
        Object value = arguments.get(name);
        return value instanceof Number n ? n.intValue() : null;
    }

    public int integer(String name, int defaultValue) {
        Object value = arguments.get(name);
        return value instanceof Number n ? n.intValue() : defaultValue;
    }
}
