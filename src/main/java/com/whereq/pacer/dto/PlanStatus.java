package com.whereq.pacer.dto;

import com.fasterxml.jackson.annotation.JsonValue;
import com.whereq.pacer.model.JobStatus;

import java.util.Locale;

/**
 * Externally visible plan status. NOT_FOUND is never stored, it answers
 * queries for keys without a job.
 */
public enum PlanStatus {
    PROCESSING,
    COMPLETED,
    FAILED,
    NOT_FOUND;

    public static PlanStatus of(JobStatus status) {
        return switch (status) {
            case PROCESSING -> PROCESSING;
            case COMPLETED -> COMPLETED;
            case FAILED -> FAILED;
        };
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
