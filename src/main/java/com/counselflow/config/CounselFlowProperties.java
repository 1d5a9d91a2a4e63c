package com.counselflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the AI core.
 */
@Data
@Component
@ConfigurationProperties(prefix = "counselflow")
public class CounselFlowProperties {

    private Map<String, ProviderConfig> providers = new LinkedHashMap<>();
    private OrchestratorConfig orchestrator = new OrchestratorConfig();
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    private ResponseCacheConfig responseCache = new ResponseCacheConfig();
    private ConsensusConfig consensus = new ConsensusConfig();
    private ContentCacheConfig contentCache = new ContentCacheConfig();
    private HealthConfig health = new HealthConfig();

    @Data
    public static class ProviderConfig {
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;
        private String defaultModel;
        private String region;
    }

    @Data
    public static class OrchestratorConfig {
        private Duration requestTimeout = Duration.ofSeconds(120);
        private int maxRetries = 3;
        private int defaultMaxTokens = 4000;
        private double defaultTemperature = 0.1;
        private int maxPromptLength = 50_000;
        private Duration backoffBase = Duration.ofSeconds(1);
        private Map<String, List<String>> fallbacks = defaultFallbacks();

        private static Map<String, List<String>> defaultFallbacks() {
            Map<String, List<String>> table = new LinkedHashMap<>();
            table.put("openai", new ArrayList<>(List.of("anthropic", "google")));
            table.put("anthropic", new ArrayList<>(List.of("openai", "google")));
            table.put("google", new ArrayList<>(List.of("openai", "anthropic")));
            table.put("bedrock", new ArrayList<>(List.of("anthropic", "openai")));
            return table;
        }
    }

    @Data
    public static class CircuitBreakerConfig {
        private int failureThreshold = 5;
        private Duration timeout = Duration.ofSeconds(60);
    }

    @Data
    public static class ResponseCacheConfig {
        private boolean enabled = true;
        private Duration ttl = Duration.ofSeconds(300);
        private int maxEntries = 1000;
    }

    @Data
    public static class ConsensusConfig {
        private String primaryProvider = "openai";
        private int topN = 10;
    }

    @Data
    public static class ContentCacheConfig {
        /** Backing store: {@code memory} or {@code redis}. */
        private String store = "memory";
        private long maxInMemoryEntries = 10_000;
        private Duration cleanupInterval = Duration.ofHours(1);
        private Map<String, OperationOverride> operations = new HashMap<>();
    }

    /**
     * Per operation type overrides; unset values keep the built-in defaults.
     */
    @Data
    public static class OperationOverride {
        private Long ttlSeconds;
        private Integer maxContentLength;
        private Boolean compress;
        private Boolean useContentHash;
        private Boolean cacheByUser;
        private Double similarityThreshold;
        private Long maxCacheSizeBytes;
    }

    @Data
    public static class HealthConfig {
        private boolean probeOnStartup = true;
        private Duration probeInterval = Duration.ofMinutes(5);
    }
}
