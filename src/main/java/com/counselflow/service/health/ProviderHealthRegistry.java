package com.counselflow.service.health;

import com.counselflow.model.ProviderStatus;
import com.counselflow.provider.ProviderRegistry;
import com.counselflow.resilience.CircuitState;
import com.counselflow.resilience.ProviderCircuitBreaker;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Probe results and usage counters per provider. Counters are lock-free; no
 * provider's bookkeeping blocks another's.
 */
@Component
public class ProviderHealthRegistry {

    private final Map<String, ProviderStats> stats = new ConcurrentHashMap<>();
    private final ProviderRegistry providerRegistry;
    private final ProviderCircuitBreaker circuitBreaker;

    public ProviderHealthRegistry(ProviderRegistry providerRegistry, ProviderCircuitBreaker circuitBreaker) {
        this.providerRegistry = providerRegistry;
        this.circuitBreaker = circuitBreaker;
        providerRegistry.names().forEach(name -> {
            stats(name);
            circuitBreaker.register(name);
        });
    }

    public void recordProbe(String provider, boolean healthy, long responseTimeMs) {
        ProviderStats s = stats(provider);
        s.status = healthy ? ProviderStatus.HEALTHY : ProviderStatus.UNHEALTHY;
        s.lastProbeTimeMs = responseTimeMs;
        s.lastChecked = Instant.now();
    }

    public void recordSuccess(String provider, long latencyMs, int tokens) {
        ProviderStats s = stats(provider);
        s.requests.increment();
        s.latencyTotalMs.add(latencyMs);
        s.tokens.add(tokens);
    }

    public void recordError(String provider) {
        ProviderStats s = stats(provider);
        s.requests.increment();
        s.errors.increment();
    }

    public ProviderStatus status(String provider) {
        return stats(provider).status;
    }

    public Long lastProbeTimeMs(String provider) {
        return stats(provider).lastProbeTimeMs;
    }

    public Instant lastChecked(String provider) {
        return stats(provider).lastChecked;
    }

    public long requestCount(String provider) {
        return stats(provider).requests.sum();
    }

    public long errorCount(String provider) {
        return stats(provider).errors.sum();
    }

    public long tokensUsed(String provider) {
        return stats(provider).tokens.sum();
    }

    public double errorRate(String provider) {
        long requests = requestCount(provider);
        return requests == 0 ? 0.0 : (double) errorCount(provider) / requests;
    }

    /**
     * Mean latency of successful calls, 0 when there were none.
     */
    public double averageLatencyMs(String provider) {
        ProviderStats s = stats(provider);
        long successes = s.requests.sum() - s.errors.sum();
        return successes <= 0 ? 0.0 : (double) s.latencyTotalMs.sum() / successes;
    }

    /**
     * Registered providers, best first: probe status, breaker state, error rate,
     * latency, then registration order.
     */
    public List<String> healthOrder() {
        List<String> names = providerRegistry.names();
        return names.stream()
                .sorted(Comparator
                        .comparingInt((String name) -> statusRank(status(name)))
                        .thenComparingInt(name -> breakerRank(circuitBreaker.getState(name)))
                        .thenComparingDouble(this::errorRate)
                        .thenComparingDouble(this::averageLatencyMs)
                        .thenComparingInt(names::indexOf))
                .toList();
    }

    private static int statusRank(ProviderStatus status) {
        return switch (status) {
            case HEALTHY -> 0;
            case UNKNOWN -> 1;
            case UNHEALTHY -> 2;
        };
    }

    private static int breakerRank(CircuitState state) {
        return switch (state) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
    }

    private ProviderStats stats(String provider) {
        return stats.computeIfAbsent(provider, p -> new ProviderStats());
    }

    private static final class ProviderStats {
        private volatile ProviderStatus status = ProviderStatus.UNKNOWN;
        private volatile Long lastProbeTimeMs;
        private volatile Instant lastChecked;
        private final LongAdder requests = new LongAdder();
        private final LongAdder errors = new LongAdder();
        private final LongAdder tokens = new LongAdder();
        private final LongAdder latencyTotalMs = new LongAdder();
    }
}
