package org.example.learnpath.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * xAI chat completions ({@code /v1/chat/completions}) with {@code json_object} response format.
 * Availability means an API key is configured; no request is sent to check it.
 */
public class XaiLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(XaiLlmProvider.class);
    private static final String BASE_URL = "https://api.x.ai/v1";
    private static final String SYSTEM_PROMPT =
            "You are an expert educational content creator. Respond with valid JSON only.";

    private final WebClient webClient;
    private final String apiKey;
    private final String model;
    private final int timeoutSeconds;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public XaiLlmProvider(String apiKey, String model, int timeoutSeconds) {
        this.apiKey = apiKey;
        this.model = model;
        this.timeoutSeconds = timeoutSeconds;
        this.webClient = WebClient.builder()
                .baseUrl(BASE_URL)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .build();
        log.info("xAI provider ready: model={}, timeout={}s", model, timeoutSeconds);
    }

    @Override
    public String generate(String prompt, LlmOptions options) {
        try {
            String body = webClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestBody(prompt, options))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
            return firstChoiceContent(body);
        } catch (Exception e) {
            if (e instanceof WebClientResponseException responseException) {
                log.warn("xAI rejected request: {} {}", responseException.getStatusCode(),
                        responseException.getResponseBodyAsString());
            }
            throw ProviderFailures.translate("xAI", timeoutSeconds, e);
        }
    }

    private Map<String, Object> requestBody(String prompt, LlmOptions options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", prompt)
        ));
        body.put("response_format", Map.of("type", "json_object"));
        body.put("temperature", options.temperature());
        if (options.topP() != null) {
            body.put("top_p", options.topP());
        }
        if (options.maxTokens() != null) {
            body.put("max_tokens", options.maxTokens());
        }
        return body;
    }

    private String firstChoiceContent(String body) throws Exception {
        JsonNode root = body == null ? null : objectMapper.readTree(body);
        JsonNode content = root == null ? null : root.path("choices").path(0).path("message").path("content");
        if (content == null || content.isMissingNode() || content.isNull()) {
            throw new LlmProviderException("xAI reply had no choices[0].message.content");
        }
        return content.asText();
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String getProviderName() {
        return "xai";
    }

    @Override
    public String getModelName() {
        return model;
    }
}
