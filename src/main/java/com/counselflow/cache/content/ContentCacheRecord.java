package com.counselflow.cache.content;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Stored form of a cached analysis result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentCacheRecord {

    private Map<String, Object> result;

    private OperationType operationType;

    private String contentHash;

    private int contentLength;

    private String userId;

    private Map<String, Object> additionalParams;

    private Map<String, Object> metadata;

    private Instant cachedAt;

    private long ttlSeconds;
}
