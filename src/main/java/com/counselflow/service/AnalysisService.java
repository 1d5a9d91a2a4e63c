package com.counselflow.service;

import com.counselflow.cache.content.CacheHit;
import com.counselflow.cache.content.ContentCacheService;
import com.counselflow.cache.content.OperationType;
import com.counselflow.exception.InsufficientProvidersException;
import com.counselflow.exception.ValidationException;
import com.counselflow.model.AnalysisResult;
import com.counselflow.model.GenerationRequest;
import com.counselflow.model.NormalizedResponse;
import com.counselflow.provider.ProviderRegistry;
import com.counselflow.service.consensus.ConsensusEngine;
import com.counselflow.service.consensus.ConsensusResult;
import com.counselflow.service.consensus.ProviderAnalysis;
import com.counselflow.service.consensus.RawTextAnalysis;
import com.counselflow.service.consensus.StructuredAnalysis;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structured legal analysis with content-addressed caching and optional
 * multi-provider consensus.
 */
@Slf4j
@Service
public class AnalysisService {

    private static final double ANALYSIS_TEMPERATURE = 0.1;

    private final OrchestratorService orchestrator;
    private final ConsensusEngine consensusEngine;
    private final ContentCacheService contentCache;
    private final AnalysisResponseParser parser;
    private final ProviderRegistry providerRegistry;

    public AnalysisService(
            OrchestratorService orchestrator,
            ConsensusEngine consensusEngine,
            ContentCacheService contentCache,
            AnalysisResponseParser parser,
            ProviderRegistry providerRegistry) {
        this.orchestrator = orchestrator;
        this.consensusEngine = consensusEngine;
        this.contentCache = contentCache;
        this.parser = parser;
        this.providerRegistry = providerRegistry;
    }

    /**
     * Analyze content. Fails with ValidationException, ProviderUnavailableException
     * or, for consensus runs with fewer than two answers, InsufficientProvidersException.
     */
    public Mono<AnalysisResult> analyze(
            String content,
            OperationType operationType,
            AnalysisKind analysisKind,
            boolean useConsensus,
            String userId) {
        return Mono.defer(() -> {
            if (content == null || content.isBlank()) {
                throw new ValidationException("Content to analyze must not be empty");
            }
            if (operationType == null) {
                throw new ValidationException("Operation type is required");
            }
            if (analysisKind == null) {
                throw new ValidationException("Analysis kind is required");
            }

            Map<String, Object> cacheParams = new LinkedHashMap<>();
            cacheParams.put("analysis_kind", analysisKind.code());
            cacheParams.put("consensus", useConsensus);

            // 1. Content cache
            return Mono.fromCallable(() -> contentCache.get(operationType, content, userId, cacheParams))
                    .subscribeOn(Schedulers.boundedElastic())
                    .flatMap(hit -> hit
                            .map(h -> Mono.just(fromCache(h, operationType, analysisKind, useConsensus)))
                            .orElseGet(() -> compute(content, operationType, analysisKind, useConsensus)
                                    .flatMap(result -> store(result, content, userId, cacheParams))));
        });
    }

    private Mono<AnalysisResult> compute(
            String content, OperationType operationType, AnalysisKind kind, boolean useConsensus) {
        String prompt = kind.prompt(content);
        return useConsensus
                ? consensusAnalysis(prompt, operationType, kind)
                : singleAnalysis(prompt, operationType, kind);
    }

    private Mono<AnalysisResult> singleAnalysis(String prompt, OperationType operationType, AnalysisKind kind) {
        GenerationRequest request = GenerationRequest.builder()
                .prompt(prompt)
                .temperature(ANALYSIS_TEMPERATURE)
                .useCache(false)
                .build();

        return orchestrator.generateText(request)
                .map(response -> {
                    ProviderAnalysis analysis = parser.parse(response);
                    Map<String, Object> result = resultOf(analysis, kind);
                    log.info("{} analysis completed by {} ({} tokens)",
                            kind.code(), response.getProvider(), response.getTokensUsed());

                    return AnalysisResult.builder()
                            .operationType(operationType)
                            .analysisKind(kind.code())
                            .result(result)
                            .structured(analysis instanceof StructuredAnalysis)
                            .consensus(false)
                            .metadata(metadataOf(response))
                            .build();
                });
    }

    private Mono<AnalysisResult> consensusAnalysis(String prompt, OperationType operationType, AnalysisKind kind) {
        List<String> providers = providerRegistry.names();
        if (providers.size() < 2) {
            return Mono.error(new InsufficientProvidersException(providers.size()));
        }

        long start = System.currentTimeMillis();
        return Flux.fromIterable(providers)
                .flatMap(provider -> orchestrator.generateText(GenerationRequest.builder()
                                .prompt(prompt)
                                .provider(provider)
                                .temperature(ANALYSIS_TEMPERATURE)
                                .useCache(false)
                                .allowFallback(false)
                                .build())
                        .map(parser::parse)
                        .onErrorResume(error -> {
                            log.warn("Provider {} dropped from consensus: {}", provider, error.getMessage());
                            return Mono.empty();
                        }))
                .collectList()
                .flatMap(analyses -> consensusEngine.combine(analyses, providers.size()))
                .map(consensus -> {
                    Map<String, Object> metadata = new LinkedHashMap<>();
                    metadata.put("providers", consensus.getProvidersUsed());
                    metadata.put("tokens_used", consensus.getTotalTokens());
                    metadata.put("processing_time_ms", System.currentTimeMillis() - start);
                    metadata.put("confidence_score", consensus.getConfidenceScore());

                    return AnalysisResult.builder()
                            .operationType(operationType)
                            .analysisKind(kind.code())
                            .result(consensus.toResultMap())
                            .structured(isStructured(consensus))
                            .consensus(true)
                            .consensusResult(consensus)
                            .metadata(metadata)
                            .build();
                });
    }

    private Mono<AnalysisResult> store(
            AnalysisResult result, String content, String userId, Map<String, Object> cacheParams) {
        return Mono.fromRunnable(() -> contentCache.put(result.getOperationType(), content, result.getResult(),
                        userId, cacheParams, result.getMetadata()))
                .subscribeOn(Schedulers.boundedElastic())
                .thenReturn(result);
    }

    private AnalysisResult fromCache(CacheHit hit, OperationType operationType, AnalysisKind kind, boolean useConsensus) {
        Map<String, Object> result = hit.result() != null ? hit.result() : Map.of();
        return AnalysisResult.builder()
                .operationType(operationType)
                .analysisKind(kind.code())
                .result(result)
                .structured(!result.containsKey("analysis_type"))
                .consensus(useConsensus)
                .metadata(hit.metadata())
                .cacheInfo(AnalysisResult.CacheInfo.builder()
                        .hitType(hit.hitType())
                        .similarityScore(hit.similarityScore())
                        .contentHash(hit.contentHash())
                        .matchedHash(hit.matchedHash())
                        .cachedAt(hit.cachedAt())
                        .build())
                .build();
    }

    private static Map<String, Object> resultOf(ProviderAnalysis analysis, AnalysisKind kind) {
        if (analysis instanceof StructuredAnalysis) {
            return new LinkedHashMap<>(((StructuredAnalysis) analysis).data());
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("analysis", ((RawTextAnalysis) analysis).text());
        result.put("analysis_type", kind.code());
        return result;
    }

    private static boolean isStructured(ConsensusResult consensus) {
        return consensus.getSynthesizedText() == null
                || !Optional.ofNullable(consensus.getNumericFields()).orElse(Map.of()).isEmpty()
                || !Optional.ofNullable(consensus.getListFields()).orElse(Map.of()).isEmpty();
    }

    private static Map<String, Object> metadataOf(NormalizedResponse response) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("provider", response.getProvider());
        metadata.put("model", response.getModel());
        metadata.put("processing_time_ms", response.getProcessingTimeMs());
        metadata.put("tokens_used", response.getTokensUsed());
        metadata.put("cost_estimate", response.getCostEstimate());
        return metadata;
    }
}
