package com.whereq.pacer.exception;

/**
 * Exception thrown when a plan is submitted for a key whose job is still processing
 */
public class PlanAlreadyInProgressException extends RuntimeException {

    public static final String REASON = "already in progress";

    public PlanAlreadyInProgressException(String athleteName) {
        super("Training plan for " + athleteName + " is " + REASON);
    }
}
