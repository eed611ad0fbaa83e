package org.example.learnpath.config;

import org.example.learnpath.service.llm.LlmProvider;
import org.example.learnpath.service.llm.OllamaLlmProvider;
import org.example.learnpath.service.llm.XaiLlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.Locale;

/**
 * Builds one LLM provider per purpose. Each {@code ai.<purpose>.*} key falls back to the
 * matching {@code ai.reasoning.*} key, then to the built-in default.
 */
@Configuration
public class LlmProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmProviderConfig.class);

    private static final String SHARED_PREFIX = "ai.reasoning.";

    private final Environment environment;

    public LlmProviderConfig(Environment environment) {
        this.environment = environment;
    }

    @Bean
    @Qualifier("questionLlmProvider")
    public LlmProvider questionLlmProvider() {
        return providerFor("questions");
    }

    @Bean
    @Qualifier("planLlmProvider")
    public LlmProvider planLlmProvider() {
        return providerFor("plans");
    }

    LlmProvider providerFor(String purpose) {
        String type = setting(purpose, "provider", "ollama").trim().toLowerCase(Locale.ROOT);
        int timeoutSeconds = Integer.parseInt(setting(purpose, "timeout-seconds", "120"));
        String ollamaBaseUrl = setting(purpose, "ollama.base-url", "http://localhost:11434");
        String ollamaModel = setting(purpose, "ollama.model", "llama3.1:latest");

        if ("xai".equals(type)) {
            String apiKey = setting(purpose, "xai.api-key", "");
            if (!apiKey.isBlank()) {
                log.info("LLM for {}: xAI", purpose);
                return new XaiLlmProvider(apiKey, setting(purpose, "xai.model", "grok-4-1-fast-reasoning"),
                        timeoutSeconds);
            }
            log.warn("LLM for {}: xAI selected without an API key, using Ollama", purpose);
        } else if (!"ollama".equals(type)) {
            log.warn("LLM for {}: unknown provider '{}', using Ollama", purpose, type);
        } else {
            log.info("LLM for {}: Ollama", purpose);
        }
        return new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds);
    }

    private String setting(String purpose, String key, String defaultValue) {
        String shared = environment.getProperty(SHARED_PREFIX + key, defaultValue);
        return environment.getProperty("ai." + purpose + "." + key, shared);
    }
}
