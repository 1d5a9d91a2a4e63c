package com.counselflow.model;

import com.counselflow.cache.content.OperationType;
import com.counselflow.service.consensus.ConsensusResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of an analysis call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResult {

    private OperationType operationType;

    private String analysisKind;

    /**
     * Parsed answer. Prose answers appear as {@code analysis} plus {@code analysis_type}.
     */
    private Map<String, Object> result;

    /**
     * False when the model answered in prose.
     */
    private boolean structured;

    private boolean consensus;

    /**
     * Set for fresh consensus runs; cache hits carry the flattened form in {@link #result}.
     */
    private ConsensusResult consensusResult;

    /**
     * Null when the result was computed for this call.
     */
    private CacheInfo cacheInfo;

    private Map<String, Object> metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CacheInfo {

        private String hitType;

        private double similarityScore;

        private String contentHash;

        private String matchedHash;

        private Instant cachedAt;
    }
}
