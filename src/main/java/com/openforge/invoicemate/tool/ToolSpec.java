package com.openforge.invoicemate.tool;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.invoicemate.llm.model.Tool;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable description of a model-visible tool.
 *
 * A description may contain {@value #SCHEMA_PLACEHOLDER}; the registry swaps
 * it for the live database schema when the specs are handed to the model.
 */
public record ToolSpec(String name, String description, List<ToolParameter> parameters) {

    public static final String SCHEMA_PLACEHOLDER = "{{schema}}";

    public ToolSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        parameters = List.copyOf(parameters);
        Set<String> seen = new HashSet<>();
        for (ToolParameter p : parameters) {
            if (!seen.add(p.name())) {
                throw new IllegalArgumentException("Duplicate parameter '%s' on tool '%s'".formatted(p.name(), name));
            }
        }
    }

    public boolean needsSchema() {
        return description != null && description.contains(SCHEMA_PLACEHOLDER);
    }

    /** Copy with the schema placeholder replaced. */
    public ToolSpec withSchema(String schemaDescription) {
        if (!needsSchema()) return this;
        return new ToolSpec(name, description.replace(SCHEMA_PLACEHOLDER, schemaDescription), parameters);
    }

    /** JSON Schema object for the "parameters" field of a function definition. */
    public ObjectNode parametersSchema() {
        JsonNodeFactory f = JsonNodeFactory.instance;
        ObjectNode schema = f.objectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        ArrayNode required = f.arrayNode();

        for (ToolParameter p : parameters) {
            ObjectNode prop = properties.putObject(p.name());
            prop.put("type", p.type().jsonType());
            if (p.description() != null) prop.put("description", p.description());
            if (!p.allowedValues().isEmpty()) {
                ArrayNode values = prop.putArray("enum");
                p.allowedValues().forEach(values::add);
            }
            if (p.required()) required.add(p.name());
        }
        schema.set("required", required);
        return schema;
    }

    /** The wire definition sent in the "tools" array. */
    public Tool toTool() {
        return Tool.function(name, description, parametersSchema());
    }
}
