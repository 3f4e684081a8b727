package com.whereq.pacer.exception;

/**
 * Exception thrown when no plan was ever requested for a key
 */
public class PlanNotFoundException extends RuntimeException {
    public PlanNotFoundException(String athleteName) {
        super("No training plan found for athlete: " + athleteName);
    }
}
