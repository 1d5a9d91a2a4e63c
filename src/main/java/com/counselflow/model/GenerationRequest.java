package com.counselflow.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input to a text generation call. Unset numeric fields fall back to configured defaults.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GenerationRequest {

    private String prompt;

    /**
     * Preferred provider; routing may still fall back to another one.
     */
    private String provider;

    /**
     * Model override, honoured only by the preferred provider.
     */
    private String model;

    private Integer maxTokens;

    private Double temperature;

    @Builder.Default
    private boolean useCache = true;

    /**
     * Attempts before giving up; null uses the configured maximum (3 by default).
     */
    private Integer retryCount;

    /**
     * When false the call is pinned to {@link #provider}; consensus fan-out relies on this.
     */
    @Builder.Default
    private boolean allowFallback = true;
}
