package com.counselflow.service.consensus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated answer built from several providers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConsensusResult {

    /**
     * Mean of each numeric field.
     */
    private Map<String, Double> numericFields;

    /**
     * Top items of each list field, most agreed first.
     */
    private Map<String, List<String>> listFields;

    /**
     * Majority value of each scalar text field.
     */
    private Map<String, String> textFields;

    /**
     * Nested values that are not aggregated, taken from the primary provider when it reported them.
     */
    private Map<String, Object> otherFields;

    private String synthesizedText;

    /**
     * min(100, providersUsed / 3 * 100).
     */
    private double confidenceScore;

    private Map<String, FieldAgreement> providerAgreement;

    private List<String> providersUsed;

    private int totalProviders;

    private long totalTokens;

    private double avgProcessingTimeMs;

    /**
     * Flat result map in the same shape a single provider's JSON answer has.
     */
    public Map<String, Object> toResultMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        if (otherFields != null) {
            result.putAll(otherFields);
        }
        if (textFields != null) {
            result.putAll(textFields);
        }
        if (listFields != null) {
            result.putAll(listFields);
        }
        if (numericFields != null) {
            result.putAll(numericFields);
        }
        if (synthesizedText != null) {
            result.put("analysis", synthesizedText);
        }

        Map<String, Object> consensus = new LinkedHashMap<>();
        consensus.put("confidence_score", confidenceScore);
        consensus.put("providers_used", providersUsed);
        consensus.put("total_providers", totalProviders);
        consensus.put("total_tokens", totalTokens);
        consensus.put("avg_processing_time_ms", avgProcessingTimeMs);
        if (providerAgreement != null && !providerAgreement.isEmpty()) {
            Map<String, Object> agreement = new LinkedHashMap<>();
            providerAgreement.forEach((field, value) -> agreement.put(field, Map.of(
                    "mean", value.mean(),
                    "variance", value.variance(),
                    "min", value.min(),
                    "max", value.max(),
                    "reporting_providers", value.reportingProviders())));
            consensus.put("provider_agreement", agreement);
        }
        result.put("_consensus", consensus);
        return result;
    }
}
