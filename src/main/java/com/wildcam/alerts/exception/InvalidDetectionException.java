package com.wildcam.alerts.exception;

/**
 * Thrown when an incoming detection cannot be evaluated: missing species,
 * out-of-range confidence, or a missing or unparseable timestamp.
 */
public class InvalidDetectionException extends RuntimeException {

    public InvalidDetectionException(String message) {
        super(message);
    }

    public InvalidDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
