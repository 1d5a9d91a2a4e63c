package com.counselflow.cache.content;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Cacheable AI operations with their built-in cache defaults.
 */
public enum OperationType {

    // ttl seconds, max content length, cache by user, similarity threshold
    CONTRACT_ANALYSIS(7200, 500_000, false, 0.98),
    DOCUMENT_GENERATION(3600, 200_000, true, 0.95),
    LEGAL_RESEARCH(86_400, 100_000, false, 0.90),
    RISK_ASSESSMENT(7200, 300_000, false, 0.98),
    CLAUSE_EXTRACTION(14_400, 500_000, false, 0.99),
    COMPLIANCE_CHECK(3600, 300_000, false, 0.98),
    TEXT_GENERATION(1800, 50_000, true, 0.90),
    LITIGATION_STRATEGY(7200, 200_000, true, 0.95),
    LEGAL_MEMO(3600, 100_000, true, 0.95);

    private static final long DEFAULT_MAX_CACHE_SIZE_BYTES = 10L * 1024 * 1024;

    private final OperationCacheConfig defaults;

    OperationType(long ttlSeconds, int maxContentLength, boolean cacheByUser, double similarityThreshold) {
        this.defaults = new OperationCacheConfig(
                ttlSeconds, maxContentLength, true, true, cacheByUser, similarityThreshold,
                DEFAULT_MAX_CACHE_SIZE_BYTES);
    }

    /**
     * Lowercase name used in cache keys, e.g. {@code contract_analysis}.
     */
    @JsonValue
    public String code() {
        return name().toLowerCase();
    }

    public OperationCacheConfig defaults() {
        return defaults;
    }

    /**
     * Whether dates and amounts are masked before hashing.
     */
    public boolean masksVolatileValues() {
        return this == CONTRACT_ANALYSIS || this == RISK_ASSESSMENT;
    }

    public static OperationType fromCode(String code) {
        return Arrays.stream(values())
                .filter(type -> type.code().equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown operation type: " + code));
    }
}
