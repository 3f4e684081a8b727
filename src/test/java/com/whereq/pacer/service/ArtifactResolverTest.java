package com.whereq.pacer.service;

import com.whereq.pacer.exception.ArtifactMissingException;
import com.whereq.pacer.exception.PlanNotFoundException;
import com.whereq.pacer.exception.PlanNotReadyException;
import com.whereq.pacer.generator.ArtifactLocator;
import com.whereq.pacer.model.JobKey;
import com.whereq.pacer.model.JobStatus;
import com.whereq.pacer.store.InMemoryJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ArtifactResolverTest {

    private static final JobKey JANE = JobKey.of("Jane Doe");

    @TempDir
    Path directory;

    private InMemoryJobStore store;
    private ArtifactResolver resolver;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore();
        resolver = new ArtifactResolver(store, new ArtifactLocator(directory));
    }

    @Test
    void unknownAthleteIsNotFound() {
        StepVerifier.create(resolver.resolve("Nobody"))
            .expectError(PlanNotFoundException.class)
            .verify();
    }

    @Test
    void processingPlanIsNotReady() {
        store.create(JANE, "Jane Doe", null).block();

        StepVerifier.create(resolver.resolve("Jane Doe"))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(PlanNotReadyException.class);
                assertThat(((PlanNotReadyException) error).getRecord().getStatus()).isEqualTo(JobStatus.PROCESSING);
            })
            .verify();
    }

    @Test
    void failedPlanIsNotReady() {
        store.create(JANE, "Jane Doe", null).block();
        store.update(JANE, JobStatus.FAILED, "backend down", null).block();

        StepVerifier.create(resolver.resolve("Jane Doe"))
            .expectError(PlanNotReadyException.class)
            .verify();
    }

    @Test
    void completedPlanResolvesToFile() throws IOException {
        Files.write(directory.resolve("jane_doe_plan.xlsx"), new byte[] {1, 2, 3, 4});
        complete("jane_doe_plan.xlsx");

        StepVerifier.create(resolver.resolve("  JANE doe"))
            .assertNext(artifact -> {
                assertThat(artifact.getFileName()).isEqualTo("jane_doe_plan.xlsx");
                assertThat(artifact.getSize()).isEqualTo(4L);
                assertThat(artifact.getPath()).isEqualTo(directory.resolve("jane_doe_plan.xlsx"));
            })
            .verifyComplete();
    }

    @Test
    void deletedFileIsReportedMissing() {
        complete("jane_doe_plan.xlsx");

        StepVerifier.create(resolver.resolve("Jane Doe"))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(ArtifactMissingException.class);
                assertThat(((ArtifactMissingException) error).getRecord().isArtifactAvailable()).isTrue();
            })
            .verify();
    }

    @Test
    void referenceOutsideDirectoryIsReportedMissing() throws IOException {
        Path outside = Files.createTempFile("outside", ".xlsx");
        try {
            complete("../" + outside.getFileName());

            StepVerifier.create(resolver.resolve("Jane Doe"))
                .expectError(ArtifactMissingException.class)
                .verify();
        } finally {
            Files.deleteIfExists(outside);
        }
    }

    private void complete(String artifactRef) {
        store.create(JANE, "Jane Doe", null).block();
        store.update(JANE, JobStatus.COMPLETED, "12-week plan", artifactRef).block();
    }
}
