package com.openforge.invoicemate.agent.event;

/**
 * Classifies every event an exchange emits over WebSocket.
 *
 * Flow: ROUND_START → TOOL_CALL → TOOL_RESULT → … → ROUND_START → FINAL_ANSWER,
 * or CONSENT_REQUIRED when a tool asks for approval.
 */
public enum EventType {

    /** A new model round begins. */
    ROUND_START,

    /** A tool is about to run. payload = ToolCall. */
    TOOL_CALL,

    /** A tool has returned. payload = ToolResultPayload. */
    TOOL_RESULT,

    /** Final answer; exchange complete. */
    FINAL_ANSWER,

    /** The exchange stopped on a draft awaiting approval. payload = draft. */
    CONSENT_REQUIRED,

    /** The exchange failed or ran out of rounds. content = message. */
    ERROR
}
