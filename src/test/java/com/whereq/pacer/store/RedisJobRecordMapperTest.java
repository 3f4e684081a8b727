package com.whereq.pacer.store;

import com.whereq.pacer.model.JobKey;
import com.whereq.pacer.model.JobRecord;
import com.whereq.pacer.model.JobStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RedisJobRecordMapperTest {

    @Test
    void mapsCompletedHash() {
        Map<String, String> hash = new HashMap<>();
        hash.put(RedisJobRecordMapper.ATHLETE_NAME, "Jane Doe");
        hash.put(RedisJobRecordMapper.STATUS, "COMPLETED");
        hash.put(RedisJobRecordMapper.MESSAGE, "12-week plan");
        hash.put(RedisJobRecordMapper.ARTIFACT_REF, "jane_doe_plan.xlsx");
        hash.put(RedisJobRecordMapper.CREATED_AT, "2026-01-05T10:00:00Z");
        hash.put(RedisJobRecordMapper.UPDATED_AT, "2026-01-05T10:07:00Z");

        JobRecord record = RedisJobRecordMapper.fromHash(JobKey.of("Jane Doe"), hash);

        assertThat(record.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(record.isArtifactAvailable()).isTrue();
        assertThat(record.getGoals()).isNull();
        assertThat(record.getUpdatedAt()).isEqualTo(Instant.parse("2026-01-05T10:07:00Z"));
    }

    @Test
    void processingHashFallsBackToCreatedAt() {
        Map<String, String> hash = Map.of(
            RedisJobRecordMapper.STATUS, "PROCESSING",
            RedisJobRecordMapper.CREATED_AT, "2026-01-05T10:00:00Z");

        JobRecord record = RedisJobRecordMapper.fromHash(JobKey.of("Jane Doe"), hash);

        assertThat(record.getAthleteName()).isEqualTo("jane doe");
        assertThat(record.getMessage()).isEqualTo(JobRecord.PROCESSING_MESSAGE);
        assertThat(record.getUpdatedAt()).isEqualTo(record.getCreatedAt());
    }

    @Test
    void hashWithoutStatusIsRejected() {
        assertThatThrownBy(() -> RedisJobRecordMapper.fromHash(JobKey.of("Jane Doe"), Map.of()))
            .isInstanceOf(IllegalStateException.class);
    }
}
