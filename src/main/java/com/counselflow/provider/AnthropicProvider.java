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
 * Anthropic (Claude) Messages API provider.
 */
@Slf4j
@Component
public class AnthropicProvider extends AbstractLlmProvider {

    public static final String NAME = "anthropic";
    private static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    private static final String ANTHROPIC_VERSION = "2023-06-01";

    private final ObjectMapper objectMapper;

    public AnthropicProvider(WebClient webClient, CounselFlowProperties properties, ObjectMapper objectMapper) {
        super(webClient, properties, NAME, "claude-3-sonnet-20240229");
        this.objectMapper = objectMapper;
    }

    @Override
    protected Mono<Completion> invoke(String prompt, String model, int maxTokens, double temperature) {
        log.info("Forwarding request to Anthropic: model={}", model);

        return webClient.post()
                .uri(baseUrl(DEFAULT_BASE_URL) + "/v1/messages")
                .header("x-api-key", config.getApiKey())
                .header("anthropic-version", ANTHROPIC_VERSION)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(buildRequest(prompt, model, maxTokens, temperature).toString())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(AnthropicProvider::parseMessagesResponse);
    }

    private JsonNode buildRequest(String prompt, String model, int maxTokens, double temperature) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", model);
        request.put("max_tokens", maxTokens);
        request.put("temperature", temperature);

        ArrayNode messages = request.putArray("messages");
        ObjectNode user = messages.addObject();
        user.put("role", "user");
        user.put("content", prompt);
        return request;
    }

    /**
     * Concatenate the text blocks of a Messages API response. Bedrock-hosted Claude uses the same shape.
     */
    static Completion parseMessagesResponse(JsonNode response) {
        StringBuilder content = new StringBuilder();
        for (JsonNode block : response.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                content.append(block.path("text").asText());
            }
        }

        JsonNode usage = response.path("usage");
        int tokens = usage.path("input_tokens").asInt(0) + usage.path("output_tokens").asInt(0);

        return new Completion(
                response.path("id").asText(null),
                content.toString(),
                response.path("model").asText(null),
                tokens,
                response.path("stop_reason").asText(null));
    }
}
