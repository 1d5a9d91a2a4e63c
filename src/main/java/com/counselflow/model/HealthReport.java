package com.counselflow.model;

import com.counselflow.resilience.CircuitState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot returned by the health check.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthReport {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    private Map<String, ProviderHealth> providers;

    /**
     * {@value #HEALTHY} or {@value #DEGRADED}.
     */
    private String overallStatus;

    private Instant timestamp;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProviderHealth {

        private ProviderStatus status;

        /**
         * Latency of the last probe, null if never probed.
         */
        private Long responseTimeMs;

        private CircuitState circuitBreakerState;

        private long requestCount;

        private long errorCount;

        private Instant lastChecked;
    }
}
