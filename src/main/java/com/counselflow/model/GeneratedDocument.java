package com.counselflow.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A drafted legal document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedDocument {

    private String documentType;

    private String content;

    /**
     * Provider that drafted it, null when served from cache without that metadata.
     */
    private String provider;

    private String model;

    private boolean cached;
}
