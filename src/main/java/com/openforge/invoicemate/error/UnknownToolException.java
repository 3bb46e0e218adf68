package com.openforge.invoicemate.error;

/** The model asked for a tool name that was never registered. */
public class UnknownToolException extends InvoiceMateException {

    private final String toolName;

    public UnknownToolException(String toolName) {
        super(ErrorKind.UNKNOWN_TOOL, "Tool '%s' is not available.".formatted(toolName));
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }
}
