package com.counselflow.provider;

import com.counselflow.config.CounselFlowProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * OpenAI chat completions provider.
 */
@Slf4j
@Component
public class OpenAiProvider extends AbstractLlmProvider {

    public static final String NAME = "openai";
    private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    private final ObjectMapper objectMapper;

    public OpenAiProvider(WebClient webClient, CounselFlowProperties properties, ObjectMapper objectMapper) {
        super(webClient, properties, NAME, "gpt-4");
        this.objectMapper = objectMapper;
    }

    @Override
    protected Mono<Completion> invoke(String prompt, String model, int maxTokens, double temperature) {
        log.info("Forwarding request to OpenAI: model={}", model);

        return webClient.post()
                .uri(baseUrl(DEFAULT_BASE_URL) + "/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(buildRequest(prompt, model, maxTokens, temperature).toString())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(this::parseResponse);
    }

    private JsonNode buildRequest(String prompt, String model, int maxTokens, double temperature) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", model);

        ArrayNode messages = request.putArray("messages");
        ObjectNode user = messages.addObject();
        user.put("role", "user");
        user.put("content", prompt);

        request.put("max_tokens", maxTokens);
        request.put("temperature", temperature);
        return request;
    }

    private Completion parseResponse(JsonNode response) {
        JsonNode choice = response.path("choices").path(0);
        String content = choice.path("message").path("content").asText(null);
        String finishReason = choice.path("finish_reason").asText(null);
        int tokens = response.path("usage").path("total_tokens").asInt(0);

        return new Completion(
                response.path("id").asText(null),
                content,
                response.path("model").asText(null),
                tokens,
                finishReason);
    }
}
