package com.counselflow.resilience;

import java.time.Instant;

/**
 * Point-in-time copy of one provider's breaker.
 */
public record BreakerSnapshot(
        String provider,
        CircuitState state,
        int failureCount,
        Instant lastFailureTime,
        int failureThreshold,
        long timeoutSeconds) {
}
