package com.counselflow.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Providers that have credentials, keyed by name in registration order.
 */
@Slf4j
@Component
public class ProviderRegistry {

    private final Map<String, LlmProvider> providers = new LinkedHashMap<>();

    public ProviderRegistry(List<LlmProvider> candidates) {
        for (LlmProvider provider : candidates) {
            if (provider.isEnabled()) {
                providers.put(provider.getName(), provider);
                log.info("Registered provider {} (default model {})", provider.getName(), provider.getDefaultModel());
            } else {
                log.info("Provider {} has no credentials configured, skipping", provider.getName());
            }
        }

        if (providers.isEmpty()) {
            log.warn("No LLM provider is configured; generation requests will fail");
        }
    }

    public Optional<LlmProvider> get(String name) {
        return Optional.ofNullable(providers.get(name));
    }

    public boolean contains(String name) {
        return providers.containsKey(name);
    }

    /**
     * Registered provider names in registration order.
     */
    public List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(providers.keySet()));
    }

    public int size() {
        return providers.size();
    }
}
