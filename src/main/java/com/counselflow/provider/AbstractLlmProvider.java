package com.counselflow.provider;

import com.counselflow.config.CounselFlowProperties;
import com.counselflow.exception.ProviderException;
import com.counselflow.model.NormalizedResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Base class for providers: credential check, timing, error mapping and cost estimate.
 * Retries are not done here; the orchestrator owns them so each attempt reaches the breaker.
 */
@Slf4j
public abstract class AbstractLlmProvider implements LlmProvider {

    private static final String CONNECTION_TEST_PROMPT =
            "Hello, this is a test. Please respond with 'AI services are working.'";
    private static final Duration CONNECTION_TEST_TIMEOUT = Duration.ofSeconds(30);

    // USD per 1K tokens, blended input/output
    private static final Map<String, Double> PRICE_PER_1K_TOKENS = Map.of(
            "gpt-4", 0.045,
            "gpt-4o", 0.010,
            "gpt-3.5-turbo", 0.002,
            "claude-3-opus", 0.045,
            "claude-3-sonnet", 0.009,
            "claude-3-haiku", 0.00075,
            "gemini-pro", 0.001,
            "gemini-1.5-pro", 0.007
    );
    private static final double DEFAULT_PRICE_PER_1K_TOKENS = 0.01;

    protected final WebClient webClient;
    protected final CounselFlowProperties.ProviderConfig config;
    private final String name;
    private final String fallbackModel;

    protected AbstractLlmProvider(
            WebClient webClient,
            CounselFlowProperties properties,
            String name,
            String fallbackModel) {
        this.webClient = webClient;
        this.name = name;
        this.fallbackModel = fallbackModel;
        this.config = properties.getProviders().get(name);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isEnabled() {
        return config != null
                && config.isEnabled()
                && config.getApiKey() != null
                && !config.getApiKey().isBlank();
    }

    @Override
    public String getDefaultModel() {
        if (config != null && config.getDefaultModel() != null && !config.getDefaultModel().isBlank()) {
            return config.getDefaultModel();
        }
        return fallbackModel;
    }

    @Override
    public Mono<NormalizedResponse> generate(
            String prompt, String model, int maxTokens, double temperature, Duration timeout) {
        if (!isEnabled()) {
            return Mono.error(new ProviderException(name, "provider is not configured"));
        }

        String resolvedModel = model != null && !model.isBlank() ? model : getDefaultModel();
        long start = System.nanoTime();

        return Mono.defer(() -> invoke(prompt, resolvedModel, maxTokens, temperature))
                .timeout(timeout)
                .flatMap(completion -> {
                    if (completion.content() == null || completion.content().isBlank()) {
                        return Mono.error(new ProviderException(name, "empty response from model " + resolvedModel));
                    }
                    long elapsedMs = (System.nanoTime() - start) / 1_000_000;
                    return Mono.just(toResponse(completion, resolvedModel, elapsedMs));
                })
                .onErrorMap(error -> !(error instanceof ProviderException), this::mapError)
                .doOnSuccess(response -> log.debug("{} answered in {}ms ({} tokens)",
                        name, response.getProcessingTimeMs(), response.getTokensUsed()));
    }

    @Override
    public Mono<Boolean> testConnection() {
        return generate(CONNECTION_TEST_PROMPT, null, 5, 0.0, CONNECTION_TEST_TIMEOUT)
                .map(response -> true)
                .onErrorResume(error -> {
                    log.warn("Connection test failed for {}: {}", name, error.getMessage());
                    return Mono.just(false);
                });
    }

    /**
     * Configured base URL, or the provider's public endpoint.
     */
    protected String baseUrl(String defaultUrl) {
        String url = config != null && config.getBaseUrl() != null && !config.getBaseUrl().isBlank()
                ? config.getBaseUrl()
                : defaultUrl;
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * Send the request to the backend and extract the completion.
     */
    protected abstract Mono<Completion> invoke(String prompt, String model, int maxTokens, double temperature);

    /**
     * Estimate cost from the model's price per 1K tokens.
     */
    protected double estimateCost(String model, int tokens) {
        double price = DEFAULT_PRICE_PER_1K_TOKENS;
        String bestMatch = null;
        for (Map.Entry<String, Double> entry : PRICE_PER_1K_TOKENS.entrySet()) {
            // Longest match wins so gpt-4o is not priced as gpt-4
            if (model.contains(entry.getKey())
                    && (bestMatch == null || entry.getKey().length() > bestMatch.length())) {
                bestMatch = entry.getKey();
                price = entry.getValue();
            }
        }
        return tokens / 1000.0 * price;
    }

    private NormalizedResponse toResponse(Completion completion, String model, long elapsedMs) {
        Map<String, Object> metadata = new HashMap<>();
        if (completion.finishReason() != null) {
            metadata.put("finish_reason", completion.finishReason());
        }
        String reportedModel = completion.model() != null ? completion.model() : model;

        return NormalizedResponse.builder()
                .content(completion.content())
                .provider(name)
                .model(reportedModel)
                .tokensUsed(completion.tokensUsed())
                .costEstimate(estimateCost(reportedModel, completion.tokensUsed()))
                .processingTimeMs(elapsedMs)
                .requestId(completion.id() != null ? completion.id() : UUID.randomUUID().toString())
                .timestamp(Instant.now())
                .cached(false)
                .metadata(metadata)
                .build();
    }

    private ProviderException mapError(Throwable error) {
        if (error instanceof TimeoutException) {
            return new ProviderException(name, "request timed out", error);
        }
        if (error instanceof WebClientResponseException) {
            WebClientResponseException httpError = (WebClientResponseException) error;
            return new ProviderException(name,
                    "HTTP " + httpError.getStatusCode().value() + ": " + httpError.getStatusText(),
                    httpError.getStatusCode().value(), error);
        }
        if (error instanceof WebClientRequestException) {
            return new ProviderException(name, "network error: " + error.getMessage(), error);
        }
        return new ProviderException(name, "call failed: " + error.getMessage(), error);
    }

    /**
     * Raw completion extracted from a backend payload.
     */
    protected record Completion(String id, String content, String model, int tokensUsed, String finishReason) {
    }
}
