package com.whereq.pacer.service;

import com.whereq.pacer.config.PacerProperties;
import com.whereq.pacer.exception.PlanGenerationException;
import com.whereq.pacer.generator.ArtifactLocator;
import com.whereq.pacer.generator.GenerationRequest;
import com.whereq.pacer.generator.GenerationResult;
import com.whereq.pacer.generator.PlanGenerator;
import com.whereq.pacer.model.JobKey;
import com.whereq.pacer.model.JobRecord;
import com.whereq.pacer.model.JobStatus;
import com.whereq.pacer.store.JobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Background runner for accepted plan submissions.
 * Every dispatched job ends with exactly one terminal store update, whatever
 * the generator does (succeed, fail, throw, emit nothing or hang past the
 * configured timeout) and also when the runner scheduler is saturated.
 */
@Slf4j
@Service
public class PlanJobRunner {

    static final String DEFAULT_SUMMARY = "Training plan generated successfully";
    static final String SCHEDULING_FAILED_PREFIX = "Generation could not be scheduled: ";

    private final JobStore jobStore;
    private final PlanGenerator planGenerator;
    private final ArtifactLocator artifactLocator;
    private final WebhookNotifier webhookNotifier;
    private final MeterRegistry meterRegistry;
    private final Scheduler scheduler;
    private final Duration generationTimeout;

    private final Disposable.Composite inFlight = Disposables.composite();
    private final AtomicInteger inFlightCount = new AtomicInteger();

    private Counter completedCounter;
    private Counter failedCounter;
    private Timer generationTimer;

    public PlanJobRunner(JobStore jobStore,
                         PlanGenerator planGenerator,
                         ArtifactLocator artifactLocator,
                         WebhookNotifier webhookNotifier,
                         MeterRegistry meterRegistry,
                         @Qualifier("planRunnerScheduler") Scheduler scheduler,
                         PacerProperties properties) {
        this.jobStore = jobStore;
        this.planGenerator = planGenerator;
        this.artifactLocator = artifactLocator;
        this.webhookNotifier = webhookNotifier;
        this.meterRegistry = meterRegistry;
        this.scheduler = scheduler;
        this.generationTimeout = properties.getJobs().getGenerationTimeout();
    }

    @PostConstruct
    public void initialize() {
        completedCounter = Counter.builder("pacer.jobs.completed")
            .description("Number of training plans generated successfully")
            .register(meterRegistry);

        failedCounter = Counter.builder("pacer.jobs.failed")
            .description("Number of training plan generations that failed")
            .register(meterRegistry);

        generationTimer = Timer.builder("pacer.jobs.generation.time")
            .description("Training plan generation time")
            .register(meterRegistry);

        Gauge.builder("pacer.jobs.in_flight", inFlightCount::get)
            .description("Generations currently running")
            .register(meterRegistry);
    }

    /**
     * Schedule generation for an accepted submission and return immediately
     *
     * @param record freshly created PROCESSING record
     * @return handle of the background task
     */
    public Disposable dispatch(JobRecord record) {
        AtomicReference<Disposable> handle = new AtomicReference<>();
        inFlightCount.incrementAndGet();

        Disposable task = run(record)
            .subscribeOn(scheduler)
            .onErrorResume(RejectedExecutionException.class, e -> rejected(record, e))
            .doFinally(signal -> {
                inFlightCount.decrementAndGet();
                Disposable self = handle.get();
                if (self != null) {
                    inFlight.remove(self);
                }
            })
            .subscribe(
                updated -> log.debug("Runner finished job {} as {}", updated.getKey(), updated.getStatus()),
                error -> log.error("Runner for job {} terminated abnormally", record.getKey(), error));

        handle.set(task);
        if (!task.isDisposed()) {
            inFlight.add(task);
        }
        log.info("Dispatched training plan generation for {}", record.getKey());
        return task;
    }

    /**
     * Generation pipeline for one job. Emits the terminal record, or completes
     * empty when the store refused the update.
     */
    Mono<JobRecord> run(JobRecord record) {
        JobKey key = record.getKey();
        GenerationRequest request = GenerationRequest.builder()
            .key(key)
            .athleteName(record.getAthleteName())
            .goals(record.getGoals())
            .targetPath(artifactLocator.pathFor(key))
            .build();

        return Mono.defer(() -> {
                Timer.Sample sample = Timer.start(meterRegistry);
                return generate(request).doFinally(signal -> sample.stop(generationTimer));
            })
            .map(result -> completion(key, result))
            .onErrorResume(error -> Mono.just(failure(key, error)))
            .flatMap(outcome -> finish(key, outcome));
    }

    /**
     * Terminal write for a job the scheduler refused to run. The record was
     * already created, so it must not stay PROCESSING.
     */
    private Mono<JobRecord> rejected(JobRecord record, RejectedExecutionException error) {
        log.error("Runner could not schedule job {}: {}", record.getKey(), error.getMessage());
        return finish(record.getKey(), new Outcome(JobStatus.FAILED,
            SCHEDULING_FAILED_PREFIX + error.getMessage(), null));
    }

    private Mono<JobRecord> finish(JobKey key, Outcome outcome) {
        return jobStore.update(key, outcome.getStatus(), outcome.getMessage(), outcome.getArtifactRef())
            .doOnNext(this::recordOutcome)
            .flatMap(updated -> webhookNotifier.notify(updated).thenReturn(updated))
            .onErrorResume(error -> {
                log.error("Could not record outcome of job {}: {}", key, error.getMessage(), error);
                return Mono.empty();
            });
    }

    private Mono<GenerationResult> generate(GenerationRequest request) {
        Mono<GenerationResult> generation = Mono.defer(() -> planGenerator.generate(request))
            .switchIfEmpty(Mono.error(() -> new PlanGenerationException("Generator produced no result")));

        if (generationTimeout != null) {
            generation = generation.timeout(generationTimeout,
                Mono.error(() -> new PlanGenerationException("Generation timed out after " + generationTimeout)));
        }
        return generation;
    }

    private Outcome completion(JobKey key, GenerationResult result) {
        if (result.getArtifactRef() == null || result.getArtifactRef().isBlank()) {
            throw new PlanGenerationException("Generator did not produce an artifact for " + key);
        }
        String summary = result.getSummary() == null || result.getSummary().isBlank()
            ? DEFAULT_SUMMARY
            : result.getSummary();
        return new Outcome(JobStatus.COMPLETED, summary, result.getArtifactRef());
    }

    private Outcome failure(JobKey key, Throwable error) {
        String message = error.getMessage() == null || error.getMessage().isBlank()
            ? error.getClass().getSimpleName()
            : error.getMessage();
        log.error("Training plan generation for {} failed: {}", key, message, error);
        return new Outcome(JobStatus.FAILED, message, null);
    }

    private void recordOutcome(JobRecord updated) {
        if (updated.getStatus() == JobStatus.COMPLETED) {
            completedCounter.increment();
            log.info("Training plan for {} completed, artifact {}", updated.getKey(), updated.getArtifactRef());
        } else {
            failedCounter.increment();
            log.info("Training plan for {} recorded as {}", updated.getKey(), updated.getStatus());
        }
    }

    public int getInFlightCount() {
        return inFlightCount.get();
    }

    @PreDestroy
    public void shutdown() {
        if (inFlightCount.get() > 0) {
            log.warn("Shutting down with {} training plan generations in flight", inFlightCount.get());
        }
        inFlight.dispose();
    }

    @Value
    private static class Outcome {
        JobStatus status;
        String message;
        String artifactRef;
    }
}
