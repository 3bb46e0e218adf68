package com.openforge.invoicemate.llm.model;

/**
 * The "function" sub-object inside a ToolCall returned by the LLM.
 *
 * "arguments" is the raw JSON string exactly as the model produced it.
 * It is untyped until the registry validates it against the tool's spec.
 *
 * Example:
 *   name      = "execute_sql_query_tool"
 *   arguments = "{\"sql_query\":\"SELECT TOP 5 * FROM Invoices\"}"
 */
public record FunctionCallResult(
        String name,
        String arguments
) {}
