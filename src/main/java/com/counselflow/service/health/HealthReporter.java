package com.counselflow.service.health;

import com.counselflow.cache.ResponseCache;
import com.counselflow.config.CounselFlowProperties;
import com.counselflow.model.HealthReport;
import com.counselflow.model.OrchestratorMetrics;
import com.counselflow.model.ProviderStatus;
import com.counselflow.provider.LlmProvider;
import com.counselflow.provider.ProviderRegistry;
import com.counselflow.resilience.CircuitState;
import com.counselflow.resilience.ProviderCircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Probes providers and reports health and usage metrics.
 */
@Slf4j
@Component
public class HealthReporter {

    private final ProviderRegistry providerRegistry;
    private final ProviderHealthRegistry healthRegistry;
    private final ProviderCircuitBreaker circuitBreaker;
    private final ResponseCache responseCache;
    private final CounselFlowProperties properties;

    public HealthReporter(
            ProviderRegistry providerRegistry,
            ProviderHealthRegistry healthRegistry,
            ProviderCircuitBreaker circuitBreaker,
            ResponseCache responseCache,
            CounselFlowProperties properties) {
        this.providerRegistry = providerRegistry;
        this.healthRegistry = healthRegistry;
        this.circuitBreaker = circuitBreaker;
        this.responseCache = responseCache;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void probeOnStartup() {
        if (!properties.getHealth().isProbeOnStartup()) {
            return;
        }
        log.info("Probing {} provider(s) before routing", providerRegistry.size());
        probeAll().subscribe();
    }

    @Scheduled(
            initialDelayString = "${counselflow.health.probe-interval:PT5M}",
            fixedDelayString = "${counselflow.health.probe-interval:PT5M}")
    public void scheduledProbe() {
        probeAll().subscribe();
    }

    /**
     * Run {@code testConnection} against every registered provider in parallel.
     */
    public Mono<Void> probeAll() {
        return Flux.fromIterable(providerRegistry.names())
                .flatMap(name -> providerRegistry.get(name)
                        .map(this::probe)
                        .orElseGet(Mono::empty))
                .then();
    }

    private Mono<Boolean> probe(LlmProvider provider) {
        long start = System.currentTimeMillis();
        return provider.testConnection()
                .onErrorReturn(false)
                .doOnNext(healthy -> {
                    long elapsed = System.currentTimeMillis() - start;
                    healthRegistry.recordProbe(provider.getName(), healthy, elapsed);
                    if (healthy) {
                        log.info("Provider {} is healthy ({}ms)", provider.getName(), elapsed);
                    } else {
                        log.warn("Provider {} failed its health probe", provider.getName());
                    }
                });
    }

    public HealthReport healthCheck() {
        Map<String, HealthReport.ProviderHealth> providers = new LinkedHashMap<>();
        boolean allHealthy = providerRegistry.size() > 0;

        for (String name : providerRegistry.names()) {
            ProviderStatus status = healthRegistry.status(name);
            CircuitState breaker = circuitBreaker.getState(name);
            providers.put(name, HealthReport.ProviderHealth.builder()
                    .status(status)
                    .responseTimeMs(healthRegistry.lastProbeTimeMs(name))
                    .circuitBreakerState(breaker)
                    .requestCount(healthRegistry.requestCount(name))
                    .errorCount(healthRegistry.errorCount(name))
                    .lastChecked(healthRegistry.lastChecked(name))
                    .build());

            if (status == ProviderStatus.UNHEALTHY || breaker != CircuitState.CLOSED) {
                allHealthy = false;
            }
        }

        return HealthReport.builder()
                .providers(providers)
                .overallStatus(allHealthy ? HealthReport.HEALTHY : HealthReport.DEGRADED)
                .timestamp(Instant.now())
                .build();
    }

    public OrchestratorMetrics getMetrics() {
        Map<String, OrchestratorMetrics.ProviderMetrics> providers = new LinkedHashMap<>();
        long totalRequests = 0;
        long totalErrors = 0;
        long totalTokens = 0;

        for (String name : providerRegistry.names()) {
            long requests = healthRegistry.requestCount(name);
            long errors = healthRegistry.errorCount(name);
            long tokens = healthRegistry.tokensUsed(name);
            totalRequests += requests;
            totalErrors += errors;
            totalTokens += tokens;

            providers.put(name, OrchestratorMetrics.ProviderMetrics.builder()
                    .requestCount(requests)
                    .errorCount(errors)
                    .errorRate(healthRegistry.errorRate(name))
                    .tokensUsed(tokens)
                    .averageLatencyMs(healthRegistry.averageLatencyMs(name))
                    .build());
        }

        return OrchestratorMetrics.builder()
                .totalRequests(totalRequests)
                .totalErrors(totalErrors)
                .errorRate(totalRequests == 0 ? 0.0 : (double) totalErrors / totalRequests)
                .totalTokens(totalTokens)
                .responseCacheHits(responseCache.hitCount())
                .responseCacheMisses(responseCache.missCount())
                .responseCacheSize(responseCache.size())
                .providers(providers)
                .timestamp(Instant.now())
                .build();
    }
}
