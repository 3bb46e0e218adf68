package com.openforge.invoicemate.config;

import com.openforge.invoicemate.email.EmailDeliveryException;
import com.openforge.invoicemate.artifact.StorageException;
import com.openforge.invoicemate.llm.LlmClient;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Programmatic Resilience4j wiring.
 *
 * Circuit breakers, one per LLM provider:
 *   • "primaryLlm"  (e.g. GPT-4o)
 *   • "fallbackLlm" (e.g. DeepSeek)
 *
 * Retries (each allows exactly one extra attempt):
 *   • "primaryLlm" / "fallbackLlm": transient provider failures only
 *   • "artifactStorage":            S3 upload / presign
 *   • "emailDelivery":              SMTP send of an approved draft
 */
@Configuration
public class Resilience4jConfig {

    public static final String ARTIFACT_STORAGE = "artifactStorage";
    public static final String EMAIL_DELIVERY   = "emailDelivery";

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                // treat slow calls (>60 s) as failures
                .slowCallDurationThreshold(Duration.ofSeconds(60))
                .slowCallRateThreshold(80)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordException(e -> e instanceof LlmClient.LlmException llm && llm.isTransient())
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        // Force-create the named breakers so they appear in Actuator metrics
        registry.circuitBreaker("primaryLlm");
        registry.circuitBreaker("fallbackLlm");
        return registry;
    }

    @Bean
    public CircuitBreaker primaryLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("primaryLlm");
    }

    @Bean
    public CircuitBreaker fallbackLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("fallbackLlm");
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig llmConfig = RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofSeconds(1))
                .retryOnException(e -> e instanceof LlmClient.LlmException llm && llm.isTransient())
                .build();

        RetryConfig storageConfig = RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(500))
                .retryExceptions(StorageException.class)
                .build();

        RetryConfig emailConfig = RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofSeconds(1))
                .retryOnException(e -> e instanceof EmailDeliveryException ede && ede.isTransient())
                .build();

        RetryRegistry registry = RetryRegistry.of(llmConfig);
        registry.retry("primaryLlm");
        registry.retry("fallbackLlm");
        registry.retry(ARTIFACT_STORAGE, storageConfig);
        registry.retry(EMAIL_DELIVERY, emailConfig);
        return registry;
    }

    @Bean
    public Retry primaryLlmRetry(RetryRegistry registry) {
        return registry.retry("primaryLlm");
    }

    @Bean
    public Retry fallbackLlmRetry(RetryRegistry registry) {
        return registry.retry("fallbackLlm");
    }

    @Bean
    public Retry artifactStorageRetry(RetryRegistry registry) {
        return registry.retry(ARTIFACT_STORAGE);
    }

    @Bean
    public Retry emailDeliveryRetry(RetryRegistry registry) {
        return registry.retry(EMAIL_DELIVERY);
    }
}
