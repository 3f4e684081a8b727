package com.whereq.pacer.service;

import com.whereq.pacer.exception.ArtifactMissingException;
import com.whereq.pacer.exception.PlanNotFoundException;
import com.whereq.pacer.exception.PlanNotReadyException;
import com.whereq.pacer.generator.ArtifactLocator;
import com.whereq.pacer.model.JobKey;
import com.whereq.pacer.model.JobRecord;
import com.whereq.pacer.model.PlanArtifact;
import com.whereq.pacer.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Resolves the spreadsheet of a completed plan for download
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArtifactResolver {

    private final JobStore jobStore;
    private final ArtifactLocator artifactLocator;

    /**
     * Locate the artifact of an athlete's plan
     *
     * @param athleteName athlete name
     * @return Mono with the artifact, or an error with {@link PlanNotFoundException},
     *         {@link PlanNotReadyException} or {@link ArtifactMissingException}
     */
    public Mono<PlanArtifact> resolve(String athleteName) {
        return Mono.fromCallable(() -> JobKey.of(athleteName))
            .flatMap(key -> jobStore.get(key)
                .switchIfEmpty(Mono.error(() -> new PlanNotFoundException(athleteName))))
            .flatMap(record -> {
                if (!record.isArtifactAvailable()) {
                    return Mono.error(new PlanNotReadyException(record));
                }
                return Mono.fromCallable(() -> locate(record))
                    .subscribeOn(Schedulers.boundedElastic());
            });
    }

    private PlanArtifact locate(JobRecord record) throws IOException {
        Path path = artifactLocator.resolve(record.getArtifactRef())
            .orElseThrow(() -> new ArtifactMissingException(record, "invalid reference " + record.getArtifactRef()));

        if (!Files.isRegularFile(path)) {
            log.warn("Completed plan for {} points at missing file {}", record.getKey(), path);
            throw new ArtifactMissingException(record, record.getArtifactRef());
        }
        return new PlanArtifact(record, path.getFileName().toString(), path, Files.size(path));
    }
}
