package com.counselflow.service;

import com.counselflow.cache.ResponseCache;
import com.counselflow.config.CounselFlowProperties;
import com.counselflow.exception.CircuitOpenException;
import com.counselflow.exception.ProviderException;
import com.counselflow.exception.ProviderUnavailableException;
import com.counselflow.exception.ValidationException;
import com.counselflow.model.GenerationRequest;
import com.counselflow.model.NormalizedResponse;
import com.counselflow.model.ProviderStatus;
import com.counselflow.provider.LlmProvider;
import com.counselflow.provider.ProviderRegistry;
import com.counselflow.resilience.BreakerPermit;
import com.counselflow.resilience.CircuitState;
import com.counselflow.resilience.ProviderCircuitBreaker;
import com.counselflow.service.health.ProviderHealthRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Routes generation requests across providers.
 * <p>
 * Flow: sanitize, response cache lookup, provider resolution, then up to
 * {@code retryCount} attempts. A breaker rejection moves to a fallback provider
 * without using an attempt; a failed call is recorded to the breaker, backs off
 * exponentially and moves to an untried provider when there is one.
 */
@Slf4j
@Service
public class OrchestratorService {

    private static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private final ProviderRegistry providerRegistry;
    private final ProviderCircuitBreaker circuitBreaker;
    private final ProviderHealthRegistry healthRegistry;
    private final ResponseCache responseCache;
    private final PromptSanitizer sanitizer;
    private final CounselFlowProperties properties;

    public OrchestratorService(
            ProviderRegistry providerRegistry,
            ProviderCircuitBreaker circuitBreaker,
            ProviderHealthRegistry healthRegistry,
            ResponseCache responseCache,
            PromptSanitizer sanitizer,
            CounselFlowProperties properties) {
        this.providerRegistry = providerRegistry;
        this.circuitBreaker = circuitBreaker;
        this.healthRegistry = healthRegistry;
        this.responseCache = responseCache;
        this.sanitizer = sanitizer;
        this.properties = properties;
    }

    /**
     * Generate text with caching, circuit breaking, retry and fallback.
     * Fails with {@link ValidationException} or {@link ProviderUnavailableException}.
     */
    public Mono<NormalizedResponse> generateText(GenerationRequest request) {
        return Mono.defer(() -> {
            CounselFlowProperties.OrchestratorConfig config = properties.getOrchestrator();

            String prompt = sanitizer.sanitize(request.getPrompt());
            int maxTokens = request.getMaxTokens() != null ? request.getMaxTokens() : config.getDefaultMaxTokens();
            double temperature = request.getTemperature() != null
                    ? request.getTemperature()
                    : config.getDefaultTemperature();
            int retryCount = request.getRetryCount() != null ? request.getRetryCount() : config.getMaxRetries();
            validate(maxTokens, temperature, retryCount);

            // 1. Exact response cache
            boolean useCache = request.isUseCache() && properties.getResponseCache().isEnabled();
            String cacheKey = ResponseCache.key(prompt, request.getProvider(), request.getModel(), maxTokens, temperature);
            if (useCache) {
                Optional<NormalizedResponse> cached = responseCache.get(cacheKey);
                if (cached.isPresent()) {
                    log.info("Serving cached response from {}", cached.get().getProvider());
                    return Mono.just(cached.get());
                }
            }

            // 2. Provider resolution
            String initial = resolveProvider(request);
            Routing routing = new Routing(prompt, maxTokens, temperature, retryCount, request, initial,
                    request.getProvider() != null ? request.getProvider() : initial);
            log.info("Routing request to {} (requested: {})", initial, request.getProvider());

            // 3. Attempts
            return attempt(routing, 0)
                    .doOnNext(response -> {
                        if (useCache) {
                            responseCache.put(cacheKey, response);
                        }
                    });
        });
    }

    private void validate(int maxTokens, double temperature, int retryCount) {
        if (maxTokens <= 0) {
            throw new ValidationException("maxTokens must be positive");
        }
        if (temperature < 0.0 || temperature > 2.0) {
            throw new ValidationException("temperature must be between 0 and 2");
        }
        if (retryCount < 1) {
            throw new ValidationException("retryCount must be at least 1");
        }
    }

    /**
     * Requested provider if it is registered, not known-unhealthy and its breaker
     * is not open; otherwise the best remaining provider in health order.
     */
    String resolveProvider(GenerationRequest request) {
        if (providerRegistry.size() == 0) {
            throw new ProviderUnavailableException("No LLM provider is configured");
        }

        String requested = request.getProvider();
        if (requested != null) {
            if (!request.isAllowFallback()) {
                if (!providerRegistry.contains(requested)) {
                    throw new ProviderUnavailableException("Provider " + requested + " is not configured");
                }
                return requested;
            }
            if (isPreferable(requested)) {
                return requested;
            }
            log.warn("Requested provider {} is not available, scanning by health", requested);
        }

        return healthRegistry.healthOrder().stream()
                .filter(name -> !name.equals(requested))
                .findFirst()
                .orElse(providerRegistry.names().get(0));
    }

    private boolean isPreferable(String provider) {
        return providerRegistry.contains(provider)
                && healthRegistry.status(provider) != ProviderStatus.UNHEALTHY
                && circuitBreaker.getState(provider) != CircuitState.OPEN;
    }

    private Mono<NormalizedResponse> attempt(Routing routing, int attempt) {
        String providerName = routing.current;

        BreakerPermit permit = circuitBreaker.tryAcquire(providerName);
        if (!permit.permitted()) {
            routing.rejected.add(providerName);
            routing.lastError = new CircuitOpenException(providerName);

            Optional<String> next = routing.request.isAllowFallback()
                    ? nextProvider(routing, providerName)
                    : Optional.empty();
            if (next.isEmpty()) {
                return Mono.error(exhausted(routing));
            }

            log.warn("Circuit open for {}, falling back to {}", providerName, next.get());
            routing.current = next.get();
            return attempt(routing, attempt);
        }

        LlmProvider provider = providerRegistry.get(providerName)
                .orElseThrow(() -> new ProviderUnavailableException("Provider " + providerName + " is not configured"));
        String model = providerName.equals(routing.modelOwner) ? routing.request.getModel() : null;
        Duration timeout = properties.getOrchestrator().getRequestTimeout();
        routing.tried.add(providerName);

        return provider.generate(routing.prompt, model, routing.maxTokens, routing.temperature, timeout)
                .timeout(timeout)
                .doOnCancel(() -> circuitBreaker.releaseProbe(providerName, permit))
                .doOnNext(response -> {
                    circuitBreaker.recordSuccess(providerName);
                    healthRegistry.recordSuccess(providerName, response.getProcessingTimeMs(), response.getTokensUsed());
                    if (attempt > 0 || !providerName.equals(routing.initial)) {
                        log.info("Request served by {} after {} attempt(s)", providerName, attempt + 1);
                    }
                })
                .onErrorResume(error -> {
                    Throwable cause = error instanceof TimeoutException
                            ? new ProviderException(providerName, "request timed out", error)
                            : error;
                    circuitBreaker.recordFailure(providerName);
                    healthRegistry.recordError(providerName);
                    routing.lastError = cause;

                    int nextAttempt = attempt + 1;
                    if (nextAttempt >= routing.retryCount) {
                        return Mono.error(exhausted(routing));
                    }

                    if (routing.request.isAllowFallback()) {
                        nextProvider(routing, providerName)
                                .filter(name -> !routing.tried.contains(name))
                                .ifPresent(name -> routing.current = name);
                    }

                    Duration backoff = backoff(attempt);
                    log.warn("Attempt {} on {} failed ({}), next try on {} in {}ms",
                            nextAttempt, providerName, cause.getMessage(), routing.current, backoff.toMillis());

                    return Mono.delay(backoff).then(Mono.defer(() -> attempt(routing, nextAttempt)));
                });
    }

    /**
     * Next candidate after {@code from}: its static fallbacks first, then the rest in
     * health order. Rejected providers are skipped, untried ones come before tried ones.
     */
    private Optional<String> nextProvider(Routing routing, String from) {
        Set<String> candidates = new LinkedHashSet<>();
        List<String> fallbacks = properties.getOrchestrator().getFallbacks().getOrDefault(from, List.of());
        for (String name : fallbacks) {
            if (providerRegistry.contains(name)) {
                candidates.add(name);
            }
        }
        candidates.addAll(healthRegistry.healthOrder());
        candidates.remove(from);
        candidates.removeAll(routing.rejected);

        List<String> ordered = new ArrayList<>();
        candidates.stream().filter(name -> !routing.tried.contains(name)).forEach(ordered::add);
        candidates.stream().filter(routing.tried::contains).forEach(ordered::add);
        return ordered.stream().findFirst();
    }

    /**
     * {@code backoffBase * 2^attempt}, capped.
     */
    Duration backoff(int attempt) {
        Duration base = properties.getOrchestrator().getBackoffBase();
        Duration delay = base.multipliedBy(1L << Math.min(attempt, 16));
        return delay.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : delay;
    }

    private ProviderUnavailableException exhausted(Routing routing) {
        String message = "All providers failed (tried " + routing.tried + ", circuit open " + routing.rejected + ")";
        log.error("{}: {}", message, routing.lastError != null ? routing.lastError.getMessage() : "no attempt made");
        return new ProviderUnavailableException(message, routing.lastError);
    }

    /**
     * Mutable routing state of one request. Attempts run strictly one after another.
     */
    private static final class Routing {
        private final String prompt;
        private final int maxTokens;
        private final double temperature;
        private final int retryCount;
        private final GenerationRequest request;
        private final String initial;
        private final String modelOwner;
        private final Set<String> tried = new LinkedHashSet<>();
        private final Set<String> rejected = new LinkedHashSet<>();
        private String current;
        private Throwable lastError;

        private Routing(String prompt, int maxTokens, double temperature, int retryCount,
                        GenerationRequest request, String initial, String modelOwner) {
            this.prompt = prompt;
            this.maxTokens = maxTokens;
            this.temperature = temperature;
            this.retryCount = retryCount;
            this.request = request;
            this.initial = initial;
            this.modelOwner = modelOwner;
            this.current = initial;
        }
    }
}
