package com.counselflow.service.consensus;

/**
 * Analysis answered in prose that did not parse as JSON.
 */
public record RawTextAnalysis(
        String provider,
        String text,
        int tokensUsed,
        long processingTimeMs) implements ProviderAnalysis {

    @Override
    public boolean isUsable() {
        return text != null && !text.isBlank();
    }
}
