package com.counselflow.service.consensus;

/**
 * Spread of one numeric field across providers. Variance is the population variance.
 */
public record FieldAgreement(double mean, double variance, double min, double max, int reportingProviders) {
}
