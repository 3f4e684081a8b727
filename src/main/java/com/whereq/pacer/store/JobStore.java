package com.whereq.pacer.store;

import com.whereq.pacer.model.JobKey;
import com.whereq.pacer.model.JobRecord;
import com.whereq.pacer.model.JobStatus;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Registry of training plan jobs, one record per key
 */
public interface JobStore {
    /**
     * Create a PROCESSING record for the key. Atomic per key: among concurrent
     * callers exactly one succeeds. An existing terminal record is replaced,
     * an existing PROCESSING record is not.
     *
     * @param key job key
     * @param athleteName display name as submitted
     * @param goals optional goals, may be null
     * @return Mono with the created record, or an error with
     *         {@link com.whereq.pacer.exception.PlanAlreadyInProgressException}
     */
    Mono<JobRecord> create(JobKey key, String athleteName, String goals);

    /**
     * Read the current record
     *
     * @param key job key
     * @return Mono with an immutable snapshot, empty if no job exists
     */
    Mono<JobRecord> get(JobKey key);

    /**
     * Move a PROCESSING record to a terminal state
     *
     * @param key job key
     * @param status COMPLETED or FAILED
     * @param message summary or failure reason
     * @param artifactRef artifact file name, required for COMPLETED, null otherwise
     * @return Mono with the updated record, or an error with
     *         {@link com.whereq.pacer.exception.PlanNotFoundException} when absent and
     *         {@link com.whereq.pacer.exception.JobStoreCorruptionException} when the
     *         record is already terminal
     */
    Mono<JobRecord> update(JobKey key, JobStatus status, String message, String artifactRef);

    /**
     * Count records per status
     *
     * @return Mono with a count for every status, zero included
     */
    Mono<Map<JobStatus, Long>> countByStatus();
}
