package com.openforge.invoicemate.tool;

import com.openforge.invoicemate.error.ErrorKind;
import com.openforge.invoicemate.error.InvoiceMateException;
import com.openforge.invoicemate.error.UnknownToolException;
import com.openforge.invoicemate.llm.model.ToolCall;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Immutable name → handler table for the model-visible tools.
 *
 * Built once at startup through {@link #builder(Supplier)}; registration
 * order is the order in which specs are shown to the model.
 */
@Slf4j
public final class ToolRegistry {

    private record Entry(ToolSpec spec, ToolHandler handler) {}

    private final Map<String, Entry>    entries;
    private final Supplier<String>      schemaSource;
    private final ToolArgumentValidator validator;

    private ToolRegistry(Map<String, Entry> entries, Supplier<String> schemaSource, ToolArgumentValidator validator) {
        this.entries      = Collections.unmodifiableMap(entries);
        this.schemaSource = schemaSource;
        this.validator    = validator;
    }

    public static Builder builder(Supplier<String> schemaSource) {
        return new Builder(schemaSource);
    }

    // ── Lookup ───────────────────────────────────────────────────────────────

    /**
     * All specs in registration order, with the live schema substituted into
     * descriptions that ask for it. The schema is fetched at most once per call.
     */
    public List<ToolSpec> describeAll() {
        String schema = null;
        List<ToolSpec> specs = new ArrayList<>(entries.size());
        for (Entry e : entries.values()) {
            ToolSpec spec = e.spec();
            if (spec.needsSchema()) {
                if (schema == null) schema = schemaSource.get();
                spec = spec.withSchema(schema);
            }
            specs.add(spec);
        }
        return specs;
    }

    // ── Execution ────────────────────────────────────────────────────────────

    /**
     * Runs a tool with already-validated arguments. Exceptions from the
     * handler propagate.
     *
     * @throws UnknownToolException if no tool is registered under {@code name}
     */
    public ToolResult invoke(String name, ToolInvocation invocation) {
        return entry(name).handler().execute(invocation);
    }

    /**
     * Validates and runs one model-issued call. Never throws for tool-level
     * problems: unknown tool, bad arguments and handler failures all come back
     * as a failed {@link ToolResult} keyed to the call id.
     */
    public ToolResult dispatch(ToolCall call, String conversationId) {
        String callId = call.id();
        String name   = call.name();
        try {
            Entry entry = entry(name);
            Map<String, Object> args = validator.validate(entry.spec(), call.arguments());
            ToolResult result = entry.handler().execute(new ToolInvocation(callId, conversationId, args));
            if (result == null) {
                return ToolResult.failure(callId, ErrorKind.EXECUTION_FAILED, "Tool '%s' returned no result.".formatted(name));
            }
            return result.callId() == null || result.callId().equals(callId)
                    ? result
                    : new ToolResult(callId, result.payload(), result.success(), result.requiresConsent(), result.failureKind());
        } catch (InvoiceMateException e) {
            log.info("[Tools] {} failed ({}): {}", name, e.kind(), e.getMessage());
            return ToolResult.failure(callId, e.kind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Tools] {} crashed", name, e);
            return ToolResult.failure(callId, ErrorKind.EXECUTION_FAILED,
                    "Tool '%s' failed: %s".formatted(name, e.getMessage()));
        }
    }

    private Entry entry(String name) {
        Entry entry = name == null ? null : entries.get(name);
        if (entry == null) {
            throw new UnknownToolException(name);
        }
        return entry;
    }

    // ── Builder ──────────────────────────────────────────────────────────────

    public static final class Builder {

        private final Supplier<String>    schemaSource;
        private final Map<String, Entry>  entries = new LinkedHashMap<>();
        private final List<String>        duplicates = new ArrayList<>();
        private ToolArgumentValidator     validator;

        private Builder(Supplier<String> schemaSource) {
            this.schemaSource = schemaSource;
        }

        public Builder validator(ToolArgumentValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder register(ToolSpec spec, ToolHandler handler) {
            if (entries.putIfAbsent(spec.name(), new Entry(spec, handler)) != null) {
                duplicates.add(spec.name());
            }
            return this;
        }

        /**
         * @throws IllegalStateException if two tools share a name
         */
        public ToolRegistry build() {
            if (!duplicates.isEmpty()) {
                throw new IllegalStateException("Duplicate tool names: " + duplicates);
            }
            if (validator == null) {
                throw new IllegalStateException("A ToolArgumentValidator is required");
            }
            log.info("[Tools] Registered {} tool(s): {}", entries.size(), entries.keySet());
            return new ToolRegistry(new LinkedHashMap<>(entries), schemaSource, validator);
        }
    }
}
