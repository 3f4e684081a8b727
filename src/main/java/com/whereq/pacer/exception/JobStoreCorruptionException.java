package com.whereq.pacer.exception;

/**
 * Exception thrown when a store write would violate the job state machine,
 * e.g. an update applied to a record that is already terminal.
 * Only the runner writes terminal states, so this signals a programming error.
 */
public class JobStoreCorruptionException extends RuntimeException {
    public JobStoreCorruptionException(String message) {
        super(message);
    }
}
