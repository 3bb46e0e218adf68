package com.openforge.invoicemate.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.invoicemate.llm.model.ChatRequest;
import com.openforge.invoicemate.llm.model.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Stateless HTTP client for one OpenAI-compatible provider.
 *
 * Only the blocking chat() call is offered: the orchestrator needs the whole
 * assistant turn (text or complete tool_calls) before it can act on it.
 * Resilience (retry, circuit breaking, fallback) lives in {@link LlmRouter}.
 */
@Slf4j
public class LlmClient {

    private final HttpClient   httpClient;
    private final ObjectMapper objectMapper;
    private final LlmProperties.ProviderConfig config;

    public LlmClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties.ProviderConfig config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Blocking chat completion. The request's model is replaced by the
     * provider's configured model when blank.
     */
    public ChatResponse chat(ChatRequest request) {
        if (request == null) {
            throw new LlmException("ChatRequest must not be null for provider [%s]"
                    .formatted(config.name()), false);
        }
        ChatRequest effective = request.model() == null || request.model().isBlank()
                ? request.toBuilder().model(config.model()).build()
                : request;

        String requestBody = serialize(effective);
        log.debug("[LlmClient:{}] → chat POST messages={} body-length={}",
                config.name(), effective.messages() == null ? 0 : effective.messages().size(),
                requestBody.length());

        return parseFullResponse(sendBlocking(buildHttpRequest(requestBody)));
    }

    /** The model name configured for this provider (e.g. "gpt-4o"). */
    public String modelName() {
        return config.model();
    }

    public String providerName() {
        return config.name();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest buildHttpRequest(String body) {
        return HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private HttpResponse<String> sendBlocking(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new LlmTimeoutException(
                    "Provider [%s] did not answer within %ds".formatted(config.name(), config.timeoutSeconds()), e);
        } catch (IOException e) {
            throw new LlmException("Network error calling provider [%s]".formatted(config.name()), e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted while calling provider [%s]".formatted(config.name()), e, false);
        }
    }

    private ChatResponse parseFullResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[LlmClient:{}] ← HTTP {} body-length={}", config.name(), status,
                body == null ? 0 : body.length());

        if (status == 429) throw new LlmRateLimitException(
                "Rate-limited by provider [%s].".formatted(config.name()));
        if (status >= 500) throw new LlmException(
                "Provider [%s] returned HTTP %d: %s".formatted(config.name(), status, body), true);
        if (status < 200 || status >= 300) throw new LlmException(
                "Provider [%s] returned HTTP %d: %s".formatted(config.name(), status, body), false);

        try {
            return objectMapper.readValue(body, ChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new LlmException(
                    "Failed to parse response from provider [%s]".formatted(config.name()), e, false);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize request", e, false);
        }
    }

    // ── Exception types ──────────────────────────────────────────────────────

    /**
     * Provider-level failure. {@code transientFailure} marks the calls worth
     * retrying: network errors, 429 and 5xx.
     */
    public static class LlmException extends RuntimeException {
        private final boolean transientFailure;

        public LlmException(String message, boolean transientFailure) {
            super(message);
            this.transientFailure = transientFailure;
        }

        public LlmException(String message, Throwable cause, boolean transientFailure) {
            super(message, cause);
            this.transientFailure = transientFailure;
        }

        public boolean isTransient() {
            return transientFailure;
        }
    }

    public static class LlmRateLimitException extends LlmException {
        public LlmRateLimitException(String message) { super(message, true); }
    }

    public static class LlmTimeoutException extends LlmException {
        public LlmTimeoutException(String message, Throwable cause) { super(message, cause, true); }
    }
}
