package com.whereq.pacer.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable snapshot of one training plan job.
 * Stores hand out these values directly, so a reader can never observe a
 * half-applied update.
 */
@Value
@Builder(toBuilder = true)
public class JobRecord {

    public static final String PROCESSING_MESSAGE = "Training plan is still being generated";

    @NonNull
    JobKey key;

    /**
     * Athlete name as first submitted for this key
     */
    @NonNull
    String athleteName;

    /**
     * Free-text goals, passed through to the generator unmodified
     */
    String goals;

    @NonNull
    JobStatus status;

    @NonNull
    String message;

    /**
     * Artifact file name, present only when COMPLETED
     */
    String artifactRef;

    @NonNull
    Instant createdAt;

    @NonNull
    Instant updatedAt;

    /**
     * Fresh record for an accepted submission
     */
    public static JobRecord processing(JobKey key, String athleteName, String goals, Instant now) {
        return JobRecord.builder()
            .key(key)
            .athleteName(athleteName.strip())
            .goals(goals)
            .status(JobStatus.PROCESSING)
            .message(PROCESSING_MESSAGE)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    public boolean isArtifactAvailable() {
        return status == JobStatus.COMPLETED && artifactRef != null;
    }

    /**
     * Apply a terminal transition, checking the record invariants
     *
     * @throws IllegalArgumentException if the new field values break an invariant
     */
    public JobRecord transition(JobStatus newStatus, String newMessage, String newArtifactRef, Instant now) {
        if (newMessage == null || newMessage.isBlank()) {
            throw new IllegalArgumentException("Message must not be blank for job " + key);
        }
        if (newStatus == JobStatus.COMPLETED && (newArtifactRef == null || newArtifactRef.isBlank())) {
            throw new IllegalArgumentException("Completed job " + key + " requires an artifact reference");
        }
        if (newStatus != JobStatus.COMPLETED && newArtifactRef != null) {
            throw new IllegalArgumentException("Only completed jobs carry an artifact, got " + newStatus + " for " + key);
        }
        return toBuilder()
            .status(newStatus)
            .message(newMessage)
            .artifactRef(newArtifactRef)
            .updatedAt(now)
            .build();
    }
}
