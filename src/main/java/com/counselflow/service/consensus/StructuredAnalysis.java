package com.counselflow.service.consensus;

import java.util.Map;

/**
 * Analysis answered as a JSON object.
 */
public record StructuredAnalysis(
        String provider,
        Map<String, Object> data,
        int tokensUsed,
        long processingTimeMs) implements ProviderAnalysis {

    @Override
    public boolean isUsable() {
        return data != null && !data.isEmpty();
    }
}
