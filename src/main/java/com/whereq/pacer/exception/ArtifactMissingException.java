package com.whereq.pacer.exception;

import com.whereq.pacer.model.JobRecord;
import lombok.Getter;

/**
 * Exception thrown when a completed plan's artifact is no longer in storage
 */
@Getter
public class ArtifactMissingException extends RuntimeException {

    private final transient JobRecord record;

    public ArtifactMissingException(JobRecord record, String detail) {
        super("Training plan file for " + record.getAthleteName() + " is missing: " + detail);
        this.record = record;
    }
}
