package com.counselflow.service;

import com.counselflow.cache.content.ContentCacheService;
import com.counselflow.cache.content.OperationType;
import com.counselflow.exception.ValidationException;
import com.counselflow.model.GeneratedDocument;
import com.counselflow.model.GenerationRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Drafts legal documents from templates. Drafts are cached per user since they
 * carry party-specific details.
 */
@Slf4j
@Service
public class DocumentService {

    private static final double DRAFTING_TEMPERATURE = 0.3;
    private static final int DRAFTING_MAX_TOKENS = 4000;

    private final OrchestratorService orchestrator;
    private final ContentCacheService contentCache;
    private final ObjectMapper objectMapper;

    public DocumentService(OrchestratorService orchestrator, ContentCacheService contentCache, ObjectMapper objectMapper) {
        this.orchestrator = orchestrator;
        this.contentCache = contentCache;
        this.objectMapper = objectMapper;
    }

    public Mono<GeneratedDocument> generateDocument(DocumentType type, Map<String, Object> parameters, String userId) {
        return Mono.defer(() -> {
            if (type == null) {
                throw new ValidationException("Document type is required");
            }
            String parametersJson = toJson(parameters != null ? parameters : Map.of());
            Map<String, Object> cacheParams = Map.of("document_type", type.code());

            return Mono.fromCallable(() -> contentCache.get(OperationType.DOCUMENT_GENERATION, parametersJson, userId, cacheParams))
                    .subscribeOn(Schedulers.boundedElastic())
                    .flatMap(hit -> hit
                            .map(h -> Mono.just(GeneratedDocument.builder()
                                    .documentType(type.code())
                                    .content(String.valueOf(h.result().get("document")))
                                    .provider(h.metadata() != null ? (String) h.metadata().get("provider") : null)
                                    .model(h.metadata() != null ? (String) h.metadata().get("model") : null)
                                    .cached(true)
                                    .build()))
                            .orElseGet(() -> draft(type, parametersJson, userId, cacheParams)));
        });
    }

    private Mono<GeneratedDocument> draft(DocumentType type, String parametersJson, String userId, Map<String, Object> cacheParams) {
        GenerationRequest request = GenerationRequest.builder()
                .prompt(type.prompt(parametersJson))
                .temperature(DRAFTING_TEMPERATURE)
                .maxTokens(DRAFTING_MAX_TOKENS)
                .useCache(false)
                .build();

        return orchestrator.generateText(request)
                .flatMap(response -> {
                    log.info("Drafted {} with {} ({} tokens)", type.code(), response.getProvider(), response.getTokensUsed());

                    Map<String, Object> metadata = new LinkedHashMap<>();
                    metadata.put("provider", response.getProvider());
                    metadata.put("model", response.getModel());
                    metadata.put("tokens_used", response.getTokensUsed());

                    GeneratedDocument document = GeneratedDocument.builder()
                            .documentType(type.code())
                            .content(response.getContent())
                            .provider(response.getProvider())
                            .model(response.getModel())
                            .cached(false)
                            .build();

                    return Mono.fromRunnable(() -> contentCache.put(OperationType.DOCUMENT_GENERATION, parametersJson,
                                    Map.of("document", response.getContent()), userId, cacheParams, metadata))
                            .subscribeOn(Schedulers.boundedElastic())
                            .thenReturn(document);
                });
    }

    private String toJson(Map<String, Object> parameters) {
        try {
            return objectMapper.writer()
                    .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                    .withDefaultPrettyPrinter()
                    .writeValueAsString(parameters);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Document parameters are not serializable: " + e.getOriginalMessage());
        }
    }
}
