package com.counselflow.provider;

import com.counselflow.config.CounselFlowProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Google Gemini provider over the generateContent REST endpoint.
 */
@Slf4j
@Component
public class GoogleProvider extends AbstractLlmProvider {

    public static final String NAME = "google";
    private static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";

    private final ObjectMapper objectMapper;

    public GoogleProvider(WebClient webClient, CounselFlowProperties properties, ObjectMapper objectMapper) {
        super(webClient, properties, NAME, "gemini-pro");
        this.objectMapper = objectMapper;
    }

    @Override
    protected Mono<Completion> invoke(String prompt, String model, int maxTokens, double temperature) {
        log.info("Forwarding request to Google: model={}", model);

        return webClient.post()
                .uri(baseUrl(DEFAULT_BASE_URL) + "/models/" + model + ":generateContent")
                .header("x-goog-api-key", config.getApiKey())
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(buildRequest(prompt, maxTokens, temperature).toString())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> parseResponse(response, model));
    }

    private JsonNode buildRequest(String prompt, int maxTokens, double temperature) {
        ObjectNode request = objectMapper.createObjectNode();
        ObjectNode content = request.putArray("contents").addObject();
        content.put("role", "user");
        content.putArray("parts").addObject().put("text", prompt);

        ObjectNode generationConfig = request.putObject("generationConfig");
        generationConfig.put("maxOutputTokens", maxTokens);
        generationConfig.put("temperature", temperature);
        return request;
    }

    private Completion parseResponse(JsonNode response, String model) {
        JsonNode candidate = response.path("candidates").path(0);

        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidate.path("content").path("parts")) {
            text.append(part.path("text").asText(""));
        }

        // Gemini does not always report usage
        int tokens = response.path("usageMetadata").path("totalTokenCount").asInt(0);

        return new Completion(
                null,
                text.toString(),
                model,
                tokens,
                candidate.path("finishReason").asText(null));
    }
}
