package com.openforge.invoicemate.tool;

import java.util.List;

/**
 * One declared parameter of a {@link ToolSpec}.
 *
 * @param allowedValues optional enum constraint, empty when unconstrained
 */
public record ToolParameter(
        String name,
        ParameterType type,
        boolean required,
        String description,
        List<String> allowedValues
) {

    public ToolParameter {
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
    }

    public static ToolParameter required(String name, ParameterType type, String description) {
        return new ToolParameter(name, type, true, description, List.of());
    }

    public static ToolParameter optional(String name, ParameterType type, String description) {
        return new ToolParameter(name, type, false, description, List.of());
    }
}
