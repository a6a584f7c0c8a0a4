package com.wildcam.alerts.delivery;

/**
 * Result of a single delivery attempt.
 *
 * @param statusCode HTTP status when a response was received, otherwise 0
 */
public record AttemptOutcome(Kind kind, int statusCode, String detail) {

    public enum Kind {
        SUCCESS,
        RETRYABLE_FAILURE,
        FATAL_FAILURE
    }

    public static AttemptOutcome success(int statusCode) {
        return new AttemptOutcome(Kind.SUCCESS, statusCode, null);
    }

    public static AttemptOutcome retryable(int statusCode, String detail) {
        return new AttemptOutcome(Kind.RETRYABLE_FAILURE, statusCode, detail);
    }

    public static AttemptOutcome fatal(String detail) {
        return new AttemptOutcome(Kind.FATAL_FAILURE, 0, detail);
    }
}
