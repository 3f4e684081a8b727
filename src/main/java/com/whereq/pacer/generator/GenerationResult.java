package com.whereq.pacer.generator;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Output of a successful plan generation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationResult {
    /**
     * Human-readable plan summary
     */
    private String summary;

    /**
     * Artifact file name inside the artifact directory
     */
    private String artifactRef;
}
