package com.counselflow.service.consensus;

/**
 * One provider's answer to an analysis prompt: either parsed JSON or prose.
 */
public interface ProviderAnalysis {

    String provider();

    int tokensUsed();

    long processingTimeMs();

    /**
     * Whether this answer carries anything to aggregate.
     */
    boolean isUsable();
}
