package org.example.learnpath.service.llm;

/**
 * Sampling settings for one generation call. {@code topP} and {@code maxTokens} may be null,
 * in which case the provider default applies.
 */
public record LlmOptions(double temperature, Double topP, Integer maxTokens) {

    public static LlmOptions bounded(double temperature, int maxTokens) {
        return new LlmOptions(temperature, null, maxTokens);
    }
}
