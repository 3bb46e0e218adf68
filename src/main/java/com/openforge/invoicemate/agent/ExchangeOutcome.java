package com.openforge.invoicemate.agent;

import java.util.Map;

/**
 * How one exchange ended.
 *
 * @param answer          user-visible text; for ROUND_LIMIT_EXCEEDED the fixed apology
 * @param consentPayload  the draft payload of the consent-requiring tool, else null
 * @param consentTool     name of the tool that asked for consent, else null
 */
public record ExchangeOutcome(
        Status status,
        String answer,
        Map<String, Object> consentPayload,
        String consentTool,
        int rounds
) {

    public enum Status { ANSWER, CONSENT_REQUIRED, ROUND_LIMIT_EXCEEDED }

    public static ExchangeOutcome answer(String answer, int rounds) {
        return new ExchangeOutcome(Status.ANSWER, answer, null, null, rounds);
    }

    public static ExchangeOutcome consentRequired(Map<String, Object> payload, String toolName, int rounds) {
        return new ExchangeOutcome(Status.CONSENT_REQUIRED, null, payload, toolName, rounds);
    }

    public static ExchangeOutcome roundLimitExceeded(String message, int rounds) {
        return new ExchangeOutcome(Status.ROUND_LIMIT_EXCEEDED, message, null, null, rounds);
    }
}
