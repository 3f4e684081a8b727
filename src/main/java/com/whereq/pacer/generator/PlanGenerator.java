package com.whereq.pacer.generator;

import reactor.core.publisher.Mono;

/**
 * Produces a training plan for one athlete.
 * Implementations may take minutes; the runner calls them off the request path.
 */
public interface PlanGenerator {
    /**
     * Generate the plan and write its spreadsheet to {@link GenerationRequest#getTargetPath()}
     *
     * @param request athlete, goals and artifact location
     * @return Mono with the summary and artifact reference; any error means the job failed
     */
    Mono<GenerationResult> generate(GenerationRequest request);
}
