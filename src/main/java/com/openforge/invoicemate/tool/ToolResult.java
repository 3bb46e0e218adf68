package com.openforge.invoicemate.tool;

import com.openforge.invoicemate.error.ErrorKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a tool call, sent back to the model as a tool turn.
 *
 * A result with {@code requiresConsent} set stops the current exchange: the
 * payload carries the draft the user must approve.
 */
public record ToolResult(
        String callId,
        Map<String, Object> payload,
        boolean success,
        boolean requiresConsent,
        ErrorKind failureKind
) {

    public static ToolResult success(String callId, Map<String, Object> payload) {
        return new ToolResult(callId, payload, true, false, null);
    }

    public static ToolResult consentRequired(String callId, Map<String, Object> payload) {
        return new ToolResult(callId, payload, true, true, null);
    }

    public static ToolResult failure(String callId, ErrorKind kind, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", message);
        payload.put("error_kind", kind.name());
        payload.put("retryable", kind.retryable());
        return new ToolResult(callId, payload, false, false, kind);
    }

    public String errorMessage() {
        return success ? null : String.valueOf(payload.get("error"));
    }
}
