package com.wildcam.alerts.controller;

import com.wildcam.alerts.exception.AlertNotFoundException;
import com.wildcam.alerts.exception.InvalidDetectionException;
import com.wildcam.alerts.exception.PersistenceBatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandler.class);

    @ExceptionHandler(InvalidDetectionException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidDetection(InvalidDetectionException ex) {
        log.warn("Rejected detection: {}", ex.getMessage());
        return Map.of("code", "INVALID_DETECTION", "error", ex.getMessage());
    }

    @ExceptionHandler(AlertNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(AlertNotFoundException ex) {
        return Map.of("code", "ALERT_NOT_FOUND", "error", ex.getMessage());
    }

    @ExceptionHandler(PersistenceBatchException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleBatchFailure(PersistenceBatchException ex) {
        log.error("Batch operation rolled back: {}", ex.getMessage(), ex);
        return Map.of("code", "BATCH_ROLLED_BACK",
                "error", ex.getMessage(),
                "completedBeforeFailure", ex.getCompletedBeforeFailure());
    }
}
