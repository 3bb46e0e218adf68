package com.openforge.invoicemate.tool.builtin;

import com.openforge.invoicemate.tool.ToolHandler;
import com.openforge.invoicemate.tool.ToolSpec;

/**
 * A tool shipped with the application: its spec travels with its handler.
 */
public interface BuiltinTool extends ToolHandler {

    ToolSpec spec();
}
