package com.whereq.pacer.generator;

import com.whereq.pacer.model.JobKey;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Input of a single plan generation
 */
@Value
@Builder
public class GenerationRequest {
    JobKey key;

    /**
     * Athlete name as submitted
     */
    String athleteName;

    /**
     * Goals text, may be null
     */
    String goals;

    /**
     * Where the generated spreadsheet must be written
     */
    Path targetPath;
}
