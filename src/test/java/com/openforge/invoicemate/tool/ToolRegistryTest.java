package com.openforge.invoicemate.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.invoicemate.error.ErrorKind;
import com.openforge.invoicemate.error.IssuerUnavailableException;
import com.openforge.invoicemate.error.UnknownToolException;
import com.openforge.invoicemate.llm.model.Tool;
import com.openforge.invoicemate.llm.model.ToolCall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ToolRegistryTest {

    private static final String CONVERSATION = "conv-1";

    private static final ToolSpec QUERY = new ToolSpec("query_tool",
            "Run a query.\nSchema:\n" + ToolSpec.SCHEMA_PLACEHOLDER,
            List.of(ToolParameter.required("sql_query", ParameterType.STRING, "SQL")));
    private static final ToolSpec ECHO = new ToolSpec("echo_tool", "Echo a value",
            List.of(ToolParameter.required("value", ParameterType.STRING, "value")));

    private final ToolArgumentValidator validator = new ToolArgumentValidator(new ObjectMapper());
    private Supplier<String> schemaSource;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        schemaSource = mock(Supplier.class);
        when(schemaSource.get()).thenReturn("Table: Invoices");
    }

    // ==================== Build ====================

    @Test
    void shouldRejectDuplicateToolNames() {
        ToolRegistry.Builder builder = ToolRegistry.builder(schemaSource)
                .validator(validator)
                .register(ECHO, inv -> ToolResult.success(inv.callId(), Map.of()))
                .register(ECHO, inv -> ToolResult.success(inv.callId(), Map.of()));

        IllegalStateException ex = assertThrows(IllegalStateException.class, builder::build);
        assertTrue(ex.getMessage().contains("echo_tool"));
    }

    @Test
    void shouldRequireValidator() {
        assertThrows(IllegalStateException.class, () -> ToolRegistry.builder(schemaSource).build());
    }

    // ==================== describeAll ====================

    @Test
    void shouldDescribeInRegistrationOrderWithSchemaRendered() {
        ToolRegistry registry = registry();

        List<ToolSpec> specs = registry.describeAll();

        assertEquals(List.of("query_tool", "echo_tool"), specs.stream().map(ToolSpec::name).toList());
        assertEquals("Run a query.\nSchema:\nTable: Invoices", specs.get(0).description());
        assertEquals("Echo a value", specs.get(1).description());
    }

    @Test
    void shouldFetchSchemaOncePerDescribeCall() {
        ToolRegistry registry = ToolRegistry.builder(schemaSource)
                .validator(validator)
                .register(QUERY, inv -> ToolResult.success(inv.callId(), Map.of()))
                .register(new ToolSpec("export_tool", "Export.\n" + ToolSpec.SCHEMA_PLACEHOLDER, List.of()),
                        inv -> ToolResult.success(inv.callId(), Map.of()))
                .build();

        registry.describeAll();

        verify(schemaSource, times(1)).get();
    }

    @Test
    void shouldNotFetchSchemaWhenNoToolNeedsIt() {
        ToolRegistry registry = ToolRegistry.builder(schemaSource)
                .validator(validator)
                .register(ECHO, inv -> ToolResult.success(inv.callId(), Map.of()))
                .build();

        registry.describeAll();

        verifyNoInteractions(schemaSource);
    }

    @Test
    void shouldProduceFunctionDefinitionWithJsonSchema() {
        Tool tool = registry().describeAll().get(0).toTool();

        assertEquals("function", tool.type());
        assertEquals("query_tool", tool.function().name());
        assertEquals("object", tool.function().parameters().path("type").asText());
        assertEquals("string", tool.function().parameters().path("properties").path("sql_query").path("type").asText());
        assertEquals("sql_query", tool.function().parameters().path("required").get(0).asText());
    }

    // ==================== invoke ====================

    @Test
    void shouldInvokeByName() {
        ToolResult result = registry().invoke("echo_tool",
                new ToolInvocation("call-1", CONVERSATION, Map.of("value", "hi")));

        assertTrue(result.success());
        assertEquals("hi", result.payload().get("echo"));
    }

    @Test
    void shouldThrowForUnknownNameOnInvoke() {
        ToolRegistry registry = registry();
        ToolInvocation invocation = new ToolInvocation("call-1", CONVERSATION, Map.of());

        assertThrows(UnknownToolException.class, () -> registry.invoke("drop_tables", invocation));
    }

    // ==================== dispatch ====================

    @Test
    void shouldDispatchValidatedArgumentsAndKeyResultToCallId() {
        ToolResult result = registry().dispatch(ToolCall.of("call-7", "echo_tool", "{\"value\": \"hello\"}"), CONVERSATION);

        assertTrue(result.success());
        assertEquals("call-7", result.callId());
        assertEquals("hello", result.payload().get("echo"));
        assertEquals(CONVERSATION, result.payload().get("conversation"));
    }

    @Test
    void shouldReturnFailureForUnknownTool() {
        ToolResult result = registry().dispatch(ToolCall.of("call-1", "drop_tables", "{}"), CONVERSATION);

        assertFalse(result.success());
        assertEquals(ErrorKind.UNKNOWN_TOOL, result.failureKind());
        assertEquals("UNKNOWN_TOOL", result.payload().get("error_kind"));
        assertTrue(result.errorMessage().contains("drop_tables"));
    }

    @Test
    void shouldReturnValidationFailureWithoutRunningHandler() {
        AtomicInteger calls = new AtomicInteger();
        ToolRegistry registry = ToolRegistry.builder(schemaSource)
                .validator(validator)
                .register(ECHO, inv -> {
                    calls.incrementAndGet();
                    return ToolResult.success(inv.callId(), Map.of());
                })
                .build();

        ToolResult result = registry.dispatch(ToolCall.of("call-1", "echo_tool", "{not json"), CONVERSATION);

        assertEquals(ErrorKind.VALIDATION_ERROR, result.failureKind());
        assertEquals(false, result.payload().get("retryable"));
        assertEquals(0, calls.get());
    }

    @Test
    void shouldConvertDomainExceptionToFailureWithItsKind() {
        ToolRegistry registry = ToolRegistry.builder(schemaSource)
                .validator(validator)
                .register(ECHO, inv -> {
                    throw new IssuerUnavailableException("storage down");
                })
                .build();

        ToolResult result = registry.dispatch(ToolCall.of("call-1", "echo_tool", "{\"value\": \"x\"}"), CONVERSATION);

        assertEquals(ErrorKind.ISSUER_UNAVAILABLE, result.failureKind());
        assertEquals(true, result.payload().get("retryable"));
        assertEquals("storage down", result.errorMessage());
    }

    @Test
    void shouldConvertUnexpectedExceptionToExecutionFailure() {
        ToolRegistry registry = ToolRegistry.builder(schemaSource)
                .validator(validator)
                .register(ECHO, inv -> {
                    throw new IllegalArgumentException("boom");
                })
                .build();

        ToolResult result = registry.dispatch(ToolCall.of("call-1", "echo_tool", "{\"value\": \"x\"}"), CONVERSATION);

        assertEquals(ErrorKind.EXECUTION_FAILED, result.failureKind());
        assertTrue(result.errorMessage().contains("boom"));
    }

    private ToolRegistry registry() {
        return ToolRegistry.builder(schemaSource)
                .validator(validator)
                .register(QUERY, inv -> ToolResult.success(inv.callId(), Map.of("rows", List.of())))
                .register(ECHO, inv -> ToolResult.success(inv.callId(),
                        Map.of("echo", inv.string("value"), "conversation", inv.conversationId())))
                .build();
    }
}
