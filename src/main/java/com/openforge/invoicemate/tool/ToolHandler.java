package com.openforge.invoicemate.tool;

/**
 * Executes one tool call. Implementations signal failure by throwing an
 * {@link com.openforge.invoicemate.error.InvoiceMateException}; the registry
 * converts it into a failed {@link ToolResult}.
 */
@FunctionalInterface
public interface ToolHandler {

    ToolResult execute(ToolInvocation invocation);
}
