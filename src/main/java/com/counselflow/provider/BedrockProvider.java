package com.counselflow.provider;

import com.counselflow.config.CounselFlowProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeAsyncClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Claude models hosted on AWS Bedrock.
 * Credentials use the api key slot as {@code ACCESS_KEY_ID:SECRET_ACCESS_KEY}.
 */
@Slf4j
@Component
public class BedrockProvider extends AbstractLlmProvider implements DisposableBean {

    public static final String NAME = "bedrock";
    private static final String BEDROCK_ANTHROPIC_VERSION = "bedrock-2023-05-31";
    private static final String DEFAULT_MODEL_ID = "anthropic.claude-3-sonnet-20240229-v1:0";

    private static final Map<String, String> MODEL_ALIASES = Map.of(
            "claude-3-opus", "anthropic.claude-3-opus-20240229-v1:0",
            "claude-3-opus-20240229", "anthropic.claude-3-opus-20240229-v1:0",
            "claude-3-sonnet", DEFAULT_MODEL_ID,
            "claude-3-sonnet-20240229", DEFAULT_MODEL_ID,
            "claude-3-haiku", "anthropic.claude-3-haiku-20240307-v1:0",
            "claude-3-haiku-20240307", "anthropic.claude-3-haiku-20240307-v1:0"
    );

    private final ObjectMapper objectMapper;
    private final BedrockRuntimeAsyncClient bedrockClient;

    @Autowired
    public BedrockProvider(WebClient webClient, CounselFlowProperties properties, ObjectMapper objectMapper) {
        super(webClient, properties, NAME, DEFAULT_MODEL_ID);
        this.objectMapper = objectMapper;
        this.bedrockClient = createClient();
    }

    BedrockProvider(
            WebClient webClient,
            CounselFlowProperties properties,
            ObjectMapper objectMapper,
            BedrockRuntimeAsyncClient bedrockClient) {
        super(webClient, properties, NAME, DEFAULT_MODEL_ID);
        this.objectMapper = objectMapper;
        this.bedrockClient = bedrockClient;
    }

    @Override
    public boolean isEnabled() {
        return super.isEnabled() && bedrockClient != null;
    }

    @Override
    protected Mono<Completion> invoke(String prompt, String model, int maxTokens, double temperature) {
        String modelId = resolveModelId(model);
        log.info("Forwarding request to Bedrock: model={}", modelId);

        InvokeModelRequest request = InvokeModelRequest.builder()
                .modelId(modelId)
                .contentType("application/json")
                .body(SdkBytes.fromString(buildRequest(prompt, maxTokens, temperature).toString(), StandardCharsets.UTF_8))
                .build();

        return Mono.fromFuture(() -> bedrockClient.invokeModel(request))
                .map(response -> parseResponse(response.body().asUtf8String(), modelId));
    }

    /**
     * Map friendly Claude names to Bedrock model ids.
     */
    String resolveModelId(String model) {
        if (model.startsWith("anthropic.")) {
            return model;
        }
        String modelId = MODEL_ALIASES.get(model);
        if (modelId == null) {
            log.warn("Unknown Bedrock model {}, using {}", model, DEFAULT_MODEL_ID);
            return DEFAULT_MODEL_ID;
        }
        return modelId;
    }

    private JsonNode buildRequest(String prompt, int maxTokens, double temperature) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("anthropic_version", BEDROCK_ANTHROPIC_VERSION);
        request.put("max_tokens", maxTokens);
        request.put("temperature", temperature);

        ObjectNode user = request.putArray("messages").addObject();
        user.put("role", "user");
        user.putArray("content").addObject()
                .put("type", "text")
                .put("text", prompt);
        return request;
    }

    private Completion parseResponse(String body, String modelId) {
        try {
            Completion completion = AnthropicProvider.parseMessagesResponse(objectMapper.readTree(body));
            return new Completion(completion.id(), completion.content(), modelId,
                    completion.tokensUsed(), completion.finishReason());
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed Bedrock response", e);
        }
    }

    private BedrockRuntimeAsyncClient createClient() {
        if (!super.isEnabled()) {
            log.debug("Bedrock provider is not configured, skipping client initialization");
            return null;
        }

        String[] credentials = config.getApiKey().split(":", 2);
        if (credentials.length != 2) {
            log.error("Invalid Bedrock credentials format. Expected: ACCESS_KEY_ID:SECRET_ACCESS_KEY");
            return null;
        }

        String region = config.getRegion() != null ? config.getRegion() : "us-east-1";
        BedrockRuntimeAsyncClient client = BedrockRuntimeAsyncClient.builder()
                .region(Region.of(region))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(credentials[0], credentials[1])))
                .build();

        log.info("Bedrock client initialized for region: {}", region);
        return client;
    }

    @Override
    public void destroy() {
        if (bedrockClient != null) {
            bedrockClient.close();
        }
    }
}
