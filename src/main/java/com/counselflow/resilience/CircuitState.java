package com.counselflow.resilience;

/**
 * Circuit breaker states. Transitions: CLOSED to OPEN, OPEN to HALF_OPEN,
 * HALF_OPEN to CLOSED or back to OPEN.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
