package com.whereq.pacer.service;

import com.whereq.pacer.dto.PlanSubmitResponse;
import com.whereq.pacer.exception.PlanAlreadyInProgressException;
import com.whereq.pacer.model.JobKey;
import com.whereq.pacer.model.JobRecord;
import com.whereq.pacer.model.JobStatus;
import com.whereq.pacer.store.InMemoryJobStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class PlanSubmissionServiceTest {

    private InMemoryJobStore store;
    private PlanJobRunner runner;
    private SimpleMeterRegistry meterRegistry;
    private PlanSubmissionService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore();
        runner = mock(PlanJobRunner.class);
        meterRegistry = new SimpleMeterRegistry();
        service = new PlanSubmissionService(store, runner, meterRegistry);
        service.initialize();
    }

    @Test
    void acceptedSubmissionCreatesRecordAndDispatches() {
        StepVerifier.create(service.submit("Jane Doe", "Sub-3h marathon"))
            .assertNext(response -> {
                assertThat(response.isAccepted()).isTrue();
                assertThat(response.getAthleteName()).isEqualTo("Jane Doe");
                assertThat(response.getMessage()).isEqualTo(PlanSubmitResponse.STARTED_MESSAGE);
            })
            .verifyComplete();

        ArgumentCaptor<JobRecord> dispatched = ArgumentCaptor.forClass(JobRecord.class);
        verify(runner).dispatch(dispatched.capture());
        assertThat(dispatched.getValue().getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(dispatched.getValue().getGoals()).isEqualTo("Sub-3h marathon");
        assertThat(meterRegistry.counter("pacer.submissions.accepted").count()).isEqualTo(1.0);
    }

    @Test
    void duplicateWhileProcessingIsRejected() {
        service.submit("Jane Doe", null).block();

        StepVerifier.create(service.submit("  jane   DOE", "different goals"))
            .expectError(PlanAlreadyInProgressException.class)
            .verify();

        verify(runner, times(1)).dispatch(any());
        assertThat(store.get(JobKey.of("Jane Doe")).block().getGoals()).isNull();
        assertThat(meterRegistry.counter("pacer.submissions.rejected").count()).isEqualTo(1.0);
    }

    @Test
    void resubmissionAfterTerminalStartsNewGeneration() {
        service.submit("Jane Doe", null).block();
        store.update(JobKey.of("Jane Doe"), JobStatus.FAILED, "backend down", null).block();

        StepVerifier.create(service.submit("Jane Doe", "retry"))
            .assertNext(response -> assertThat(response.isAccepted()).isTrue())
            .verifyComplete();

        verify(runner, times(2)).dispatch(any());
        assertThat(store.get(JobKey.of("Jane Doe")).block().getStatus()).isEqualTo(JobStatus.PROCESSING);
    }

    @Test
    void blankNameIsRejectedWithoutSideEffects() {
        StepVerifier.create(service.submit("   ", null))
            .expectError(IllegalArgumentException.class)
            .verify();

        verify(runner, never()).dispatch(any());
    }
}
