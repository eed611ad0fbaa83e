package org.example.learnpath.service.llm;

/**
 * Abstraction over the text-generation backends (Ollama, xAI) used for study plans and questions.
 */
public interface LlmProvider {

    /**
     * Generate a completion for the prompt.
     *
     * @param prompt the full prompt text
     * @param options sampling options (temperature, output budget)
     * @return the raw generated text
     * @throws LlmProviderException on timeout, provider error or rate limiting
     */
    String generate(String prompt, LlmOptions options);

    /**
     * @return true if the provider is configured and can accept requests
     */
    boolean isAvailable();

    /**
     * @return provider name for logging and generation bookkeeping (e.g. "ollama", "xai")
     */
    String getProviderName();

    /**
     * @return model identifier recorded on each generated question set
     */
    String getModelName();
}
