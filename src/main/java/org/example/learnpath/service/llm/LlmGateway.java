package org.example.learnpath.service.llm;

import jakarta.annotation.PreDestroy;
import org.example.learnpath.config.LearningProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs provider calls under a hard deadline and converts every failure mode into an {@link LlmResult}.
 * Nothing thrown by a provider escapes this class.
 */
@Component
public class LlmGateway {

    private static final Logger log = LoggerFactory.getLogger(LlmGateway.class);

    private final LearningProperties properties;
    private final ExecutorService executor = Executors.newCachedThreadPool();

    public LlmGateway(LearningProperties properties) {
        this.properties = properties;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    public LlmResult call(LlmProvider provider, String prompt, LlmOptions options, String purpose) {
        String providerName = provider == null ? "none" : provider.getProviderName();
        if (provider == null || !isAvailable(provider)) {
            log.warn("LLM provider {} unavailable for {}", providerName, purpose);
            return LlmResult.failure(LlmResult.FailureKind.UNAVAILABLE, "provider not available", providerName, 0L);
        }

        Duration timeout = properties.getGeneration().getTimeout();
        long startedAtMs = System.currentTimeMillis();
        log.debug("LLM request for {} via {} (temperature={}, maxTokens={}):\n{}",
                purpose, providerName, options.temperature(), options.maxTokens(), prompt);

        Future<String> future = null;
        try {
            future = executor.submit(() -> provider.generate(prompt, options));
            String text = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            long durationMs = elapsedSince(startedAtMs);
            if (text == null || text.isBlank()) {
                log.warn("LLM {} returned an empty response for {}", providerName, purpose);
                return LlmResult.failure(LlmResult.FailureKind.EMPTY_RESPONSE, "empty response", providerName, durationMs);
            }
            log.debug("LLM response for {} via {} in {} ms:\n{}", purpose, providerName, durationMs, text);
            return LlmResult.success(text, providerName, durationMs);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("LLM {} request for {} timed out after {} ms", providerName, purpose, timeout.toMillis());
            return LlmResult.failure(LlmResult.FailureKind.TIMEOUT,
                    "no response within " + timeout.toMillis() + " ms", providerName, elapsedSince(startedAtMs));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LlmResult.FailureKind kind = classify(cause);
            log.warn("LLM {} request for {} failed ({}): {}", providerName, purpose, kind, cause.getMessage());
            return LlmResult.failure(kind, cause.getMessage(), providerName, elapsedSince(startedAtMs));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return LlmResult.failure(LlmResult.FailureKind.PROVIDER_ERROR, "interrupted", providerName, elapsedSince(startedAtMs));
        } catch (RejectedExecutionException e) {
            log.warn("LLM {} request for {} rejected: executor shut down", providerName, purpose);
            return LlmResult.failure(LlmResult.FailureKind.UNAVAILABLE, "executor shut down", providerName, 0L);
        }
    }

    private boolean isAvailable(LlmProvider provider) {
        try {
            return provider.isAvailable();
        } catch (RuntimeException e) {
            log.debug("Availability check failed for {}: {}", provider.getProviderName(), e.getMessage());
            return false;
        }
    }

    private LlmResult.FailureKind classify(Throwable cause) {
        if (cause instanceof LlmProviderException providerException && providerException.getKind() != null) {
            return switch (providerException.getKind()) {
                case TIMEOUT -> LlmResult.FailureKind.TIMEOUT;
                case RATE_LIMITED -> LlmResult.FailureKind.RATE_LIMITED;
                case PROVIDER_ERROR -> LlmResult.FailureKind.PROVIDER_ERROR;
            };
        }
        if (cause instanceof TimeoutException) {
            return LlmResult.FailureKind.TIMEOUT;
        }
        return LlmResult.FailureKind.PROVIDER_ERROR;
    }

    private long elapsedSince(long startedAtMs) {
        return Math.max(0L, System.currentTimeMillis() - startedAtMs);
    }
}
