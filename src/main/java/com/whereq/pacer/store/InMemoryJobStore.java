package com.whereq.pacer.store;

import com.whereq.pacer.exception.JobStoreCorruptionException;
import com.whereq.pacer.exception.PlanAlreadyInProgressException;
import com.whereq.pacer.exception.PlanNotFoundException;
import com.whereq.pacer.model.JobKey;
import com.whereq.pacer.model.JobRecord;
import com.whereq.pacer.model.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Job store kept in process memory.
 * Records are immutable and swapped whole inside {@link ConcurrentHashMap#compute},
 * which serializes writers per key while readers go through a lock-free get.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "pacer.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryJobStore implements JobStore {

    private final ConcurrentHashMap<JobKey, JobRecord> records = new ConcurrentHashMap<>();

    private final Clock clock;

    public InMemoryJobStore() {
        this(Clock.systemUTC());
    }

    InMemoryJobStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<JobRecord> create(JobKey key, String athleteName, String goals) {
        return Mono.fromCallable(() -> records.compute(key, (k, existing) -> {
            if (existing != null && !existing.getStatus().isTerminal()) {
                throw new PlanAlreadyInProgressException(athleteName);
            }
            if (existing != null) {
                log.info("Replacing {} record for {} with a new submission", existing.getStatus(), key);
            }
            return JobRecord.processing(key, athleteName, goals, clock.instant());
        }));
    }

    @Override
    public Mono<JobRecord> get(JobKey key) {
        return Mono.fromSupplier(() -> records.get(key));
    }

    @Override
    public Mono<JobRecord> update(JobKey key, JobStatus status, String message, String artifactRef) {
        return Mono.fromCallable(() -> {
            if (!status.isTerminal()) {
                throw new JobStoreCorruptionException("Job " + key + " cannot be moved back to " + status);
            }
            JobRecord updated = records.computeIfPresent(key, (k, existing) -> {
                if (existing.getStatus().isTerminal()) {
                    throw new JobStoreCorruptionException(
                        "Job " + key + " is already " + existing.getStatus() + ", refusing update to " + status);
                }
                return existing.transition(status, message, artifactRef, clock.instant());
            });
            if (updated == null) {
                throw new PlanNotFoundException(key.getValue());
            }
            return updated;
        });
    }

    @Override
    public Mono<Map<JobStatus, Long>> countByStatus() {
        return Mono.fromSupplier(() -> {
            Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
            for (JobStatus status : JobStatus.values()) {
                counts.put(status, 0L);
            }
            records.values().forEach(r -> counts.merge(r.getStatus(), 1L, Long::sum));
            return counts;
        });
    }
}
