package com.counselflow.model;

/**
 * Result of the most recent connectivity probe.
 */
public enum ProviderStatus {
    HEALTHY,
    UNHEALTHY,
    UNKNOWN
}
