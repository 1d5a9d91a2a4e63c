package com.counselflow;

import com.counselflow.cache.content.ContentCacheService;
import com.counselflow.cache.content.ContentCacheStatistics;
import com.counselflow.cache.content.OperationType;
import com.counselflow.model.AnalysisResult;
import com.counselflow.model.GeneratedDocument;
import com.counselflow.model.GenerationRequest;
import com.counselflow.model.HealthReport;
import com.counselflow.model.NormalizedResponse;
import com.counselflow.model.OrchestratorMetrics;
import com.counselflow.service.AnalysisKind;
import com.counselflow.service.AnalysisService;
import com.counselflow.service.DocumentService;
import com.counselflow.service.DocumentType;
import com.counselflow.service.OrchestratorService;
import com.counselflow.service.health.HealthReporter;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Entry point for business modules. One instance is created at startup and injected
 * wherever AI features are needed.
 */
@Component
public class AiGateway {

    private final OrchestratorService orchestrator;
    private final AnalysisService analysisService;
    private final DocumentService documentService;
    private final ContentCacheService contentCache;
    private final HealthReporter healthReporter;

    public AiGateway(
            OrchestratorService orchestrator,
            AnalysisService analysisService,
            DocumentService documentService,
            ContentCacheService contentCache,
            HealthReporter healthReporter) {
        this.orchestrator = orchestrator;
        this.analysisService = analysisService;
        this.documentService = documentService;
        this.contentCache = contentCache;
        this.healthReporter = healthReporter;
    }

    public Mono<NormalizedResponse> generateText(GenerationRequest request) {
        return orchestrator.generateText(request);
    }

    public Mono<AnalysisResult> analyze(
            String content, OperationType operationType, AnalysisKind analysisKind, boolean useConsensus, String userId) {
        return analysisService.analyze(content, operationType, analysisKind, useConsensus, userId);
    }

    public Mono<GeneratedDocument> generateDocument(DocumentType type, Map<String, Object> parameters, String userId) {
        return documentService.generateDocument(type, parameters, userId);
    }

    public HealthReport healthCheck() {
        return healthReporter.healthCheck();
    }

    public OrchestratorMetrics getMetrics() {
        return healthReporter.getMetrics();
    }

    public ContentCacheStatistics getCacheStatistics() {
        return contentCache.getStatistics();
    }

    public long invalidateByOperationType(OperationType type) {
        return contentCache.invalidateByOperationType(type);
    }

    public long invalidateByUser(String userId) {
        return contentCache.invalidateByUser(userId);
    }
}
