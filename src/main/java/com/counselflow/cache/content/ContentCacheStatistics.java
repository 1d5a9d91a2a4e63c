package com.counselflow.cache.content;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Content cache statistics per operation type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentCacheStatistics {

    private int operationTypes;

    /**
     * Keyed by operation type code.
     */
    private Map<String, OperationCacheConfig> configurations;

    private Map<String, UsageStats> usageStats;

    /**
     * Sum of the per-type estimated sizes in bytes.
     */
    private long totalCacheSize;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UsageStats {

        private long totalCached;

        private long totalSize;

        private long currentEntries;

        private long estimatedSize;

        private long hits;

        private long misses;

        private double hitRate;
    }
}
