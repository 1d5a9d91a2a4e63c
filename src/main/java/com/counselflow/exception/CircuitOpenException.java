package com.counselflow.exception;

import lombok.Getter;

/**
 * The provider's circuit breaker rejected the call.
 */
@Getter
public class CircuitOpenException extends AiCoreException {

    private final String provider;

    public CircuitOpenException(String provider) {
        super("Circuit breaker is open for provider: " + provider);
        this.provider = provider;
    }
}
