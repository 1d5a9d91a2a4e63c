package com.counselflow.provider;

import com.counselflow.model.NormalizedResponse;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Interface for LLM backends.
 */
public interface LlmProvider {

    /**
     * Get provider name (e.g., "openai", "anthropic").
     */
    String getName();

    /**
     * Whether credentials are configured for this provider.
     */
    boolean isEnabled();

    /**
     * Model used when the caller does not ask for one.
     */
    String getDefaultModel();

    /**
     * Run one completion. Errors, timeouts and empty or malformed bodies
     * surface as {@link com.counselflow.exception.ProviderException}.
     *
     * @param model model id, or null for {@link #getDefaultModel()}
     */
    Mono<NormalizedResponse> generate(String prompt, String model, int maxTokens, double temperature, Duration timeout);

    /**
     * Minimal-token round trip used to mark health before routing.
     */
    Mono<Boolean> testConnection();
}
