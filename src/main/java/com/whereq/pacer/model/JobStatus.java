package com.whereq.pacer.model;

/**
 * Stored lifecycle states of a training plan job
 *
 * State transitions:
 * PROCESSING → {COMPLETED, FAILED}
 * Terminal states never transition again; a retry is a new submission.
 */
public enum JobStatus {
    /**
     * Generation dispatched, result not yet recorded
     */
    PROCESSING,

    /**
     * Plan generated, artifact available
     */
    COMPLETED,

    /**
     * Generation failed, message holds the reason
     */
    FAILED;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
