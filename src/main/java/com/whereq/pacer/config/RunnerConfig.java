package com.whereq.pacer.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Scheduler for background plan generation, kept apart from the request
 * handling event loop
 */
@Slf4j
@Configuration
public class RunnerConfig {

    public static final String RUNNER_THREAD_PREFIX = "plan-runner";

    @Bean(destroyMethod = "dispose")
    public Scheduler planRunnerScheduler(PacerProperties properties) {
        PacerProperties.JobsConfig jobs = properties.getJobs();

        log.info("Plan runner scheduler: {} threads, queue capacity {}, generation timeout {}",
            jobs.getRunnerThreads(), jobs.getRunnerQueueCapacity(),
            jobs.getGenerationTimeout() != null ? jobs.getGenerationTimeout() : "none");

        return Schedulers.newBoundedElastic(
            jobs.getRunnerThreads(),
            jobs.getRunnerQueueCapacity(),
            RUNNER_THREAD_PREFIX);
    }
}
