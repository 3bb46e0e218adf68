package com.openforge.invoicemate.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalised LLM provider configuration.
 *
 * Reads from application.yml under the "agent.llm" prefix:
 *
 * agent:
 *   llm:
 *     primary:
 *       name: azure-gpt-4o
 *       base-url: https://api.openai.com/v1
 *       api-key: ${LLM_PRIMARY_API_KEY}
 *       model: gpt-4o
 *       timeout-seconds: 120
 *     fallback:
 *       name: deepseek-chat
 *       base-url: https://api.deepseek.com/v1
 *       api-key: ${LLM_FALLBACK_API_KEY}
 *       model: deepseek-chat
 *
 * The fallback block is optional; without it every failure of the primary
 * provider surfaces directly to the caller.
 */
@ConfigurationProperties(prefix = "agent.llm")
public record LlmProperties(
        ProviderConfig primary,
        ProviderConfig fallback
) {

    public boolean hasFallback() {
        return fallback != null && fallback.baseUrl() != null && !fallback.baseUrl().isBlank();
    }

    public record ProviderConfig(
            String name,
            String baseUrl,
            String apiKey,
            String model,
            @DefaultValue("120") int timeoutSeconds
    ) {}
}
