package com.whereq.pacer.exception;

/**
 * Exception raised by a plan generator when it cannot produce a plan
 */
public class PlanGenerationException extends RuntimeException {
    public PlanGenerationException(String message) {
        super(message);
    }

    public PlanGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
