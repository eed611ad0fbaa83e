package org.example.learnpath.service.llm;

/**
 * Outcome of a guarded LLM call: either the generated text or the reason the call failed.
 * Callers branch on {@link #succeeded()} and build fallback content explicitly.
 */
public record LlmResult(
        String text,
        FailureKind failureKind,
        String failureMessage,
        String providerName,
        long durationMs
) {

    public enum FailureKind {
        TIMEOUT,
        PROVIDER_ERROR,
        RATE_LIMITED,
        UNAVAILABLE,
        EMPTY_RESPONSE
    }

    public static LlmResult success(String text, String providerName, long durationMs) {
        return new LlmResult(text, null, null, providerName, durationMs);
    }

    public static LlmResult failure(FailureKind kind, String message, String providerName, long durationMs) {
        return new LlmResult(null, kind, message, providerName, durationMs);
    }

    public boolean succeeded() {
        return failureKind == null;
    }

    public String describeFailure() {
        if (succeeded()) {
            return "";
        }
        return failureMessage == null || failureMessage.isBlank()
                ? failureKind.name()
                : failureKind.name() + ": " + failureMessage;
    }
}
