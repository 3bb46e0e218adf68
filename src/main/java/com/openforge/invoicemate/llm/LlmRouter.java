package com.openforge.invoicemate.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.invoicemate.error.UpstreamTimeoutException;
import com.openforge.invoicemate.error.UpstreamUnavailableException;
import com.openforge.invoicemate.llm.model.ChatRequest;
import com.openforge.invoicemate.llm.model.ChatResponse;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.function.Supplier;

/**
 * High-availability LLM request router.
 *
 * Call graph:
 *
 *   chat(request)
 *     └─ primaryCircuitBreaker + primaryRetry
 *           └─ primaryLlmClient.chat(request)
 *                 ↓ (on CallNotPermittedException or any exception)
 *     └─ fallbackCircuitBreaker + fallbackRetry
 *           └─ fallbackLlmClient.chat(request)
 *
 * When every configured provider fails, the last failure is translated into
 * {@link UpstreamTimeoutException} (a provider timed out) or
 * {@link UpstreamUnavailableException} (anything else).
 */
@Slf4j
@Component
@EnableConfigurationProperties(LlmProperties.class)
public class LlmRouter {

    private final LlmClient      primaryClient;
    private final LlmClient      fallbackClient;
    private final CircuitBreaker primaryCb;
    private final CircuitBreaker fallbackCb;
    private final Retry          primaryRetry;
    private final Retry          fallbackRetry;

    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     CircuitBreaker primaryLlmCircuitBreaker,
                     CircuitBreaker fallbackLlmCircuitBreaker,
                     Retry primaryLlmRetry,
                     Retry fallbackLlmRetry) {
        this.primaryClient  = new LlmClient(httpClient, objectMapper, properties.primary());
        this.fallbackClient = properties.hasFallback()
                ? new LlmClient(httpClient, objectMapper, properties.fallback())
                : null;
        this.primaryCb      = primaryLlmCircuitBreaker;
        this.fallbackCb     = fallbackLlmCircuitBreaker;
        this.primaryRetry   = primaryLlmRetry;
        this.fallbackRetry  = fallbackLlmRetry;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Route a chat request through primary → fallback with full resilience.
     *
     * The model field in ChatRequest is overridden by the provider's own
     * configured model name, so callers only need to pass messages and tools.
     */
    public ChatResponse chat(ChatRequest request) {
        try {
            ChatRequest primaryRequest = overrideModel(request, primaryClient.modelName());
            return executeWithResilience(primaryCb, primaryRetry,
                    () -> primaryClient.chat(primaryRequest));
        } catch (RuntimeException primaryException) {
            if (fallbackClient == null) {
                throw translate(primaryException);
            }
            log.warn("[LlmRouter] Primary provider failed ({}), engaging fallback. Cause: {}",
                    primaryException.getClass().getSimpleName(), primaryException.getMessage());

            ChatRequest fallbackRequest = overrideModel(request, fallbackClient.modelName());
            try {
                return executeWithResilience(fallbackCb, fallbackRetry,
                        () -> fallbackClient.chat(fallbackRequest));
            } catch (RuntimeException fallbackException) {
                throw translate(fallbackException);
            }
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /**
     * Decorates a supplier with circuit-breaker + retry, then executes it.
     * Fully programmatic, no AOP proxies.
     */
    private ChatResponse executeWithResilience(CircuitBreaker cb,
                                               Retry retry,
                                               Supplier<ChatResponse> call) {
        return CircuitBreaker.decorateSupplier(cb, Retry.decorateSupplier(retry, call)).get();
    }

    private RuntimeException translate(RuntimeException e) {
        if (e instanceof LlmClient.LlmTimeoutException) {
            return new UpstreamTimeoutException(
                    "The language model did not respond in time. Please try again.", e);
        }
        if (e instanceof CallNotPermittedException) {
            return new UpstreamUnavailableException(
                    "The language model is temporarily unavailable. Please try again shortly.", e);
        }
        log.error("[LlmRouter] All providers failed: {}", e.getMessage());
        return new UpstreamUnavailableException(
                "The language model is unavailable. Please try again.", e);
    }

    private ChatRequest overrideModel(ChatRequest original, String modelName) {
        return original.toBuilder().model(modelName).build();
    }
}
