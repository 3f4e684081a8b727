package com.whereq.pacer.store;

import com.whereq.pacer.config.PacerProperties;
import com.whereq.pacer.exception.JobStoreCorruptionException;
import com.whereq.pacer.exception.PlanAlreadyInProgressException;
import com.whereq.pacer.exception.PlanNotFoundException;
import com.whereq.pacer.model.JobKey;
import com.whereq.pacer.model.JobRecord;
import com.whereq.pacer.model.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Job store backed by Redis, one hash per job.
 * Create and update are Lua scripts, so the status check and the write happen
 * atomically on the server even with several service instances.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "pacer.store", name = "type", havingValue = "redis")
public class RedisJobStore implements JobStore {

    private static final String OK = "OK";
    private static final String MISSING = "MISSING";

    private static final RedisScript<String> CREATE_SCRIPT =
        RedisScript.of(new ClassPathResource("scripts/create-job.lua"), String.class);

    private static final RedisScript<String> UPDATE_SCRIPT =
        RedisScript.of(new ClassPathResource("scripts/update-job.lua"), String.class);

    private final ReactiveStringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final Duration ttl;
    private final Clock clock;

    public RedisJobStore(ReactiveStringRedisTemplate redisTemplate, PacerProperties properties) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = properties.getStore().getKeyPrefix();
        this.ttl = properties.getStore().getTtl();
        this.clock = Clock.systemUTC();
        log.info("Using Redis job store: prefix={}, ttl={}", keyPrefix, ttl);
    }

    @Override
    public Mono<JobRecord> create(JobKey key, String athleteName, String goals) {
        JobRecord record = JobRecord.processing(key, athleteName, goals, clock.instant());

        List<String> args = List.of(
            record.getAthleteName(),
            record.getMessage(),
            record.getCreatedAt().toString(),
            goals != null ? goals : "",
            String.valueOf(ttl.toMillis()));

        return redisTemplate.execute(CREATE_SCRIPT, List.of(redisKey(key)), args)
            .next()
            .flatMap(outcome -> OK.equals(outcome)
                ? Mono.just(record)
                : Mono.error(new PlanAlreadyInProgressException(athleteName)));
    }

    @Override
    public Mono<JobRecord> get(JobKey key) {
        return redisTemplate.<String, String>opsForHash()
            .entries(redisKey(key))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue)
            .filter(hash -> !hash.isEmpty())
            .map(hash -> RedisJobRecordMapper.fromHash(key, hash));
    }

    @Override
    public Mono<JobRecord> update(JobKey key, JobStatus status, String message, String artifactRef) {
        if (!status.isTerminal()) {
            return Mono.error(new JobStoreCorruptionException("Job " + key + " cannot be moved back to " + status));
        }

        return get(key)
            .switchIfEmpty(Mono.error(() -> new PlanNotFoundException(key.getValue())))
            .flatMap(existing -> {
                if (existing.getStatus().isTerminal()) {
                    return Mono.error(new JobStoreCorruptionException(
                        "Job " + key + " is already " + existing.getStatus() + ", refusing update to " + status));
                }
                JobRecord updated = existing.transition(status, message, artifactRef, clock.instant());

                List<String> args = List.of(
                    existing.getCreatedAt().toString(),
                    status.name(),
                    message,
                    artifactRef != null ? artifactRef : "",
                    updated.getUpdatedAt().toString(),
                    String.valueOf(ttl.toMillis()));

                return redisTemplate.execute(UPDATE_SCRIPT, List.of(redisKey(key)), args)
                    .next()
                    .flatMap(outcome -> {
                        if (OK.equals(outcome)) {
                            return Mono.just(updated);
                        }
                        if (MISSING.equals(outcome)) {
                            return Mono.error(new PlanNotFoundException(key.getValue()));
                        }
                        return Mono.error(new JobStoreCorruptionException(
                            "Job " + key + " changed concurrently (" + outcome + "), refusing update to " + status));
                    });
            });
    }

    @Override
    public Mono<Map<JobStatus, Long>> countByStatus() {
        return redisTemplate.scan(ScanOptions.scanOptions().match(keyPrefix + "*").build())
            .flatMap(redisKey -> redisTemplate.<String, String>opsForHash().get(redisKey, RedisJobRecordMapper.STATUS))
            .map(JobStatus::valueOf)
            .collect(() -> {
                Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
                for (JobStatus s : JobStatus.values()) {
                    counts.put(s, 0L);
                }
                return counts;
            }, (counts, s) -> counts.merge(s, 1L, Long::sum));
    }

    private String redisKey(JobKey key) {
        return keyPrefix + key.getValue();
    }
}
