package com.whereq.pacer.service;

import com.whereq.pacer.dto.PlanSubmitResponse;
import com.whereq.pacer.exception.PlanAlreadyInProgressException;
import com.whereq.pacer.model.JobKey;
import com.whereq.pacer.store.JobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Service for training plan submission
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlanSubmissionService {

    private final JobStore jobStore;
    private final PlanJobRunner planJobRunner;
    private final MeterRegistry meterRegistry;

    private Counter acceptedCounter;
    private Counter rejectedCounter;

    @PostConstruct
    public void initialize() {
        acceptedCounter = Counter.builder("pacer.submissions.accepted")
            .description("Number of plan submissions that started a generation")
            .register(meterRegistry);

        rejectedCounter = Counter.builder("pacer.submissions.rejected")
            .description("Number of plan submissions rejected because a generation was running")
            .register(meterRegistry);
    }

    /**
     * Submit a plan for async generation. Returns as soon as the job record
     * exists; generation runs on the plan runner.
     *
     * @param athleteName athlete name, must not be blank
     * @param goals optional goals, passed to the generator unmodified
     * @return Mono with the accepted response, or an error with
     *         {@link IllegalArgumentException} for a blank name and
     *         {@link PlanAlreadyInProgressException} when a generation is running for the key
     */
    public Mono<PlanSubmitResponse> submit(String athleteName, String goals) {
        return Mono.fromCallable(() -> JobKey.of(athleteName))
            .flatMap(key -> jobStore.create(key, athleteName, goals))
            .doOnNext(planJobRunner::dispatch)
            .map(record -> PlanSubmitResponse.builder()
                .accepted(true)
                .athleteName(record.getAthleteName())
                .message(PlanSubmitResponse.STARTED_MESSAGE)
                .build())
            .doOnSuccess(response -> {
                acceptedCounter.increment();
                log.info("Training plan submission accepted for {}", response.getAthleteName());
            })
            .doOnError(PlanAlreadyInProgressException.class, e -> {
                rejectedCounter.increment();
                log.warn("Training plan submission rejected: {}", e.getMessage());
            });
    }
}
