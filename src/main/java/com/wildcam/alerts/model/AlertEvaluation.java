package com.wildcam.alerts.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only outcome of evaluating one detection. Persisting it as an Alert is up to the caller.
 */
@Value
@Builder
@Schema(description = "Result of evaluating a detection for alerting")
public class AlertEvaluation {

    @Schema(description = "Detection that was evaluated", example = "DET-000123")
    String detectionId;

    @Schema(description = "Pattern-matching confidence", example = "0.5")
    double mlConfidence;

    @Schema(description = "Whether the detection resembles learned false positives", example = "false")
    boolean falsePositive;

    @Schema(description = "Severity tier", example = "EMERGENCY")
    Severity priority;

    @Schema(description = "Whether environmental conditions call for suppression", example = "false")
    boolean shouldFilter;

    @Schema(description = "Time-of-day significance score", example = "0.9")
    double temporalScore;

    @Schema(description = "Suggested handling", example = "IMMEDIATE_ACTION")
    Recommendation recommendation;
}
