package com.whereq.pacer.service;

import com.whereq.pacer.dto.PlanStatusResponse;
import com.whereq.pacer.model.JobKey;
import com.whereq.pacer.store.JobStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Read-only view of plan status, safe to poll
 */
@Service
@RequiredArgsConstructor
public class PlanStatusService {

    private final JobStore jobStore;

    /**
     * Current status of the plan for an athlete
     *
     * @param athleteName athlete name, any casing or spacing of the submitted one
     * @return Mono with the status; NOT_FOUND when no plan was ever requested
     */
    public Mono<PlanStatusResponse> status(String athleteName) {
        return Mono.fromCallable(() -> JobKey.of(athleteName))
            .flatMap(jobStore::get)
            .map(PlanStatusResponse::from)
            .defaultIfEmpty(PlanStatusResponse.notFound());
    }
}
