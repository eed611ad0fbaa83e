package org.example.learnpath.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Local Ollama server, non-streaming {@code /api/generate} in JSON mode. Study plans and question
 * sets are both JSON documents, so every request sets {@code "format": "json"}.
 */
public class OllamaLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(OllamaLlmProvider.class);
    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(2);

    private final WebClient webClient;
    private final String model;
    private final int timeoutSeconds;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OllamaLlmProvider(String baseUrl, String model, int timeoutSeconds) {
        this.webClient = WebClient.builder().baseUrl(baseUrl).build();
        this.model = model;
        this.timeoutSeconds = timeoutSeconds;
        log.info("Ollama provider ready: baseUrl={}, model={}, timeout={}s", baseUrl, model, timeoutSeconds);
    }

    @Override
    public String generate(String prompt, LlmOptions options) {
        try {
            String body = webClient.post()
                    .uri("/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestBody(prompt, options))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
            return generatedText(body);
        } catch (Exception e) {
            if (e instanceof WebClientResponseException responseException) {
                log.warn("Ollama rejected request: {} {}", responseException.getStatusCode(),
                        responseException.getResponseBodyAsString());
            }
            throw ProviderFailures.translate("Ollama", timeoutSeconds, e);
        }
    }

    private Map<String, Object> requestBody(String prompt, LlmOptions options) {
        Map<String, Object> sampling = new LinkedHashMap<>();
        sampling.put("temperature", options.temperature());
        if (options.topP() != null) {
            sampling.put("top_p", options.topP());
        }
        if (options.maxTokens() != null) {
            sampling.put("num_predict", options.maxTokens());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("prompt", prompt);
        body.put("format", "json");
        body.put("stream", false);
        body.put("options", sampling);
        return body;
    }

    private String generatedText(String body) throws Exception {
        JsonNode root = body == null ? null : objectMapper.readTree(body);
        JsonNode response = root == null ? null : root.get("response");
        if (response == null || response.isNull()) {
            throw new LlmProviderException("Ollama reply had no 'response' field");
        }
        return response.asText();
    }

    @Override
    public boolean isAvailable() {
        try {
            webClient.get()
                    .uri("/api/tags")
                    .retrieve()
                    .toBodilessEntity()
                    .block(PROBE_TIMEOUT);
            return true;
        } catch (RuntimeException e) {
            log.debug("Ollama availability check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String getProviderName() {
        return "ollama";
    }

    @Override
    public String getModelName() {
        return model;
    }
}
