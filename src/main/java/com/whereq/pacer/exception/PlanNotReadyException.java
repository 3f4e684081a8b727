package com.whereq.pacer.exception;

import com.whereq.pacer.model.JobRecord;
import lombok.Getter;

/**
 * Exception thrown when a download is requested for a plan that has not completed
 */
@Getter
public class PlanNotReadyException extends RuntimeException {

    private final transient JobRecord record;

    public PlanNotReadyException(JobRecord record) {
        super("Training plan for " + record.getAthleteName() + " is not ready yet");
        this.record = record;
    }
}
