package com.counselflow.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provider-independent generation result.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class NormalizedResponse {

    private String content;

    private String provider;

    private String model;

    private int tokensUsed;

    /**
     * Estimated cost in USD.
     */
    private double costEstimate;

    private long processingTimeMs;

    private String requestId;

    private Instant timestamp;

    private boolean cached;

    private Map<String, Object> metadata;

    /**
     * Independent copy: the metadata map is copied as well.
     */
    public NormalizedResponse copy() {
        return toBuilder()
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : null)
                .build();
    }

    /**
     * Independent copy flagged as served from cache.
     */
    public NormalizedResponse asCached() {
        NormalizedResponse copy = copy();
        copy.setCached(true);
        return copy;
    }
}
