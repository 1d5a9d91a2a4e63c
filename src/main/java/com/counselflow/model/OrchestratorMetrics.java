package com.counselflow.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Usage counters, error rates and cache size.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrchestratorMetrics {

    private long totalRequests;

    private long totalErrors;

    /**
     * Errors over requests, 0 when nothing was sent.
     */
    private double errorRate;

    private long totalTokens;

    private long responseCacheHits;

    private long responseCacheMisses;

    private int responseCacheSize;

    private Map<String, ProviderMetrics> providers;

    private Instant timestamp;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProviderMetrics {

        private long requestCount;

        private long errorCount;

        private double errorRate;

        private long tokensUsed;

        private double averageLatencyMs;
    }
}
