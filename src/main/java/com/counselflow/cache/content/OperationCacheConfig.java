package com.counselflow.cache.content;

import com.counselflow.config.CounselFlowProperties;

/**
 * Cache settings for one operation type.
 */
public record OperationCacheConfig(
        long ttlSeconds,
        int maxContentLength,
        boolean compress,
        boolean useContentHash,
        boolean cacheByUser,
        double similarityThreshold,
        long maxCacheSizeBytes) {

    public OperationCacheConfig {
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be within [0, 1]");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive");
        }
    }

    /**
     * Apply the configured override; null fields keep this config's values.
     */
    public OperationCacheConfig merge(CounselFlowProperties.OperationOverride override) {
        if (override == null) {
            return this;
        }
        return new OperationCacheConfig(
                override.getTtlSeconds() != null ? override.getTtlSeconds() : ttlSeconds,
                override.getMaxContentLength() != null ? override.getMaxContentLength() : maxContentLength,
                override.getCompress() != null ? override.getCompress() : compress,
                override.getUseContentHash() != null ? override.getUseContentHash() : useContentHash,
                override.getCacheByUser() != null ? override.getCacheByUser() : cacheByUser,
                override.getSimilarityThreshold() != null ? override.getSimilarityThreshold() : similarityThreshold,
                override.getMaxCacheSizeBytes() != null ? override.getMaxCacheSizeBytes() : maxCacheSizeBytes);
    }
}
