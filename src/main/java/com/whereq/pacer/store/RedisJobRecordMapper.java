package com.whereq.pacer.store;

import com.whereq.pacer.model.JobKey;
import com.whereq.pacer.model.JobRecord;
import com.whereq.pacer.model.JobStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Converts the Redis hash of a job into a {@link JobRecord}
 */
final class RedisJobRecordMapper {

    static final String ATHLETE_NAME = "athleteName";
    static final String GOALS = "goals";
    static final String STATUS = "status";
    static final String MESSAGE = "message";
    static final String ARTIFACT_REF = "artifactRef";
    static final String CREATED_AT = "createdAt";
    static final String UPDATED_AT = "updatedAt";

    private RedisJobRecordMapper() {
    }

    static JobRecord fromHash(JobKey key, Map<String, String> hash) {
        String status = hash.get(STATUS);
        if (status == null) {
            throw new IllegalStateException("Redis hash for job " + key + " has no status field");
        }
        return JobRecord.builder()
            .key(key)
            .athleteName(hash.getOrDefault(ATHLETE_NAME, key.getValue()))
            .goals(hash.get(GOALS))
            .status(JobStatus.valueOf(status))
            .message(hash.getOrDefault(MESSAGE, JobRecord.PROCESSING_MESSAGE))
            .artifactRef(hash.get(ARTIFACT_REF))
            .createdAt(Instant.parse(hash.get(CREATED_AT)))
            .updatedAt(Instant.parse(hash.getOrDefault(UPDATED_AT, hash.get(CREATED_AT))))
            .build();
    }
}
