package org.example.learnpath.service.llm;

import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Translates WebClient failures into {@link LlmProviderException}s with a {@link LlmProviderException.Kind}.
 */
final class ProviderFailures {

    private ProviderFailures() {
    }

    static LlmProviderException translate(String providerLabel, int timeoutSeconds, Exception e) {
        if (e instanceof LlmProviderException providerException) {
            return providerException;
        }
        if (e instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            LlmProviderException.Kind kind = status == HttpStatus.TOO_MANY_REQUESTS.value()
                    ? LlmProviderException.Kind.RATE_LIMITED
                    : LlmProviderException.Kind.PROVIDER_ERROR;
            return new LlmProviderException(kind, providerLabel + " returned HTTP " + status, e);
        }
        if (e instanceof TimeoutException || e.getCause() instanceof TimeoutException) {
            return new LlmProviderException(LlmProviderException.Kind.TIMEOUT,
                    providerLabel + " did not respond within " + timeoutSeconds + "s", e);
        }
        return new LlmProviderException(LlmProviderException.Kind.PROVIDER_ERROR,
                providerLabel + " request failed: " + e.getMessage(), e);
    }
}
