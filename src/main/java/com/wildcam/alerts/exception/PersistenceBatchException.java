package com.wildcam.alerts.exception;

/**
 * A multi-record write failed part way through. Records already written in the
 * batch have been restored to their previous state before this is thrown.
 */
public class PersistenceBatchException extends RuntimeException {

    private final int completedBeforeFailure;

    public PersistenceBatchException(String message, int completedBeforeFailure, Throwable cause) {
        super(message, cause);
        this.completedBeforeFailure = completedBeforeFailure;
    }

    public int getCompletedBeforeFailure() {
        return completedBeforeFailure;
    }
}
