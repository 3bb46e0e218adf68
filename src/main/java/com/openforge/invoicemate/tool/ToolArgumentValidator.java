package com.openforge.invoicemate.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.invoicemate.error.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses the model's raw argument string and checks it against a {@link ToolSpec}.
 *
 * Undeclared arguments are dropped. Missing required arguments, wrong JSON
 * types and values outside an enum are rejected with a message the model can
 * act on.
 */
@Slf4j
public class ToolArgumentValidator {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ToolArgumentValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> validate(ToolSpec spec, String rawArguments) {
        Map<String, Object> parsed = parse(spec, rawArguments);
        Map<String, Object> accepted = new LinkedHashMap<>();

        for (ToolParameter p : spec.parameters()) {
            Object value = parsed.get(p.name());
            if (value == null) {
                if (p.required()) {
                    throw new ValidationException("Missing required parameter '%s' for tool '%s'."
                            .formatted(p.name(), spec.name()));
                }
                continue;
            }
            if (!p.type().accepts(value)) {
                throw new ValidationException("Parameter '%s' of tool '%s' must be of type %s."
                        .formatted(p.name(), spec.name(), p.type().jsonType()));
            }
            if (!p.allowedValues().isEmpty() && !p.allowedValues().contains(value.toString())) {
                throw new ValidationException("Parameter '%s' of tool '%s' must be one of %s."
                        .formatted(p.name(), spec.name(), p.allowedValues()));
            }
            accepted.put(p.name(), value);
        }

        parsed.keySet().stream()
                .filter(k -> !accepted.containsKey(k) && spec.parameters().stream().noneMatch(p -> p.name().equals(k)))
                .forEach(k -> log.debug("[Tools] Ignoring undeclared argument '{}' for {}", k, spec.name()));
        return accepted;
    }

    private Map<String, Object> parse(ToolSpec spec, String rawArguments) {
        if (rawArguments == null || rawArguments.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(rawArguments, MAP_TYPE);
            return parsed == null ? Map.of() : parsed;
        } catch (JsonProcessingException e) {
            throw new ValidationException("Arguments for tool '%s' are not a valid JSON object: %s"
                    .formatted(spec.name(), e.getOriginalMessage()), e);
        }
    }
}
