package com.wildcam.alerts.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Outcome of ingesting a detection")
public record ProcessingOutcome(Status status, String alertId, String reason) {

    public enum Status { SUCCESS, FILTERED, FAILED }

    public static ProcessingOutcome success(String alertId) {
        return new ProcessingOutcome(Status.SUCCESS, alertId, null);
    }

    public static ProcessingOutcome filtered(String alertId, String reason) {
        return new ProcessingOutcome(Status.FILTERED, alertId, reason);
    }

    public static ProcessingOutcome failed(String reason) {
        return new ProcessingOutcome(Status.FAILED, null, reason);
    }
}
