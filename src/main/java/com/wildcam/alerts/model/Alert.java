package com.wildcam.alerts.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "An evaluated wildlife alert")
public class Alert {

    @Schema(description = "Alert identifier", example = "ALT-DET-000123")
    private String alertId;

    @Schema(description = "Detection this alert was derived from", example = "DET-000123")
    private String detectionId;

    @Schema(description = "Camera that produced the detection", example = "CAM-07")
    private String cameraId;

    @Schema(description = "Detected species", example = "grizzly_bear")
    private String species;

    @Schema(description = "Alert category", example = "wildlife_detection")
    @Builder.Default
    private String alertType = "wildlife_detection";

    @Schema(description = "Severity tier", example = "EMERGENCY")
    private Severity severity;

    @Schema(description = "Routing priority derived from severity", example = "high", allowableValues = {"high", "normal", "low"})
    private String priority;

    private String title;

    private String message;

    @Schema(description = "Opaque detection context carried to notification payloads")
    @Builder.Default
    private Map<String, Object> data = new HashMap<>();

    @Schema(description = "Pattern-matching confidence", example = "0.82")
    private double mlConfidence;

    @Schema(description = "1.0 when pattern matching predicted a false positive, else 0.0", example = "0.0")
    private double falsePositiveScore;

    @Schema(description = "Activity anomaly score (|z|)", example = "3.4")
    private double anomalyScore;

    @Schema(description = "Time-of-day significance", example = "0.9")
    private double temporalScore;

    @Schema(description = "User-confirmed false positive flag; null until feedback is received")
    private Boolean userFalsePositive;

    @JsonProperty("isFiltered")
    @Schema(description = "Whether delivery was suppressed", example = "false")
    private boolean filtered;

    @Schema(description = "Why the alert was filtered")
    private String filterReason;

    @Schema(description = "Suggested handling", example = "IMMEDIATE_ACTION")
    private Recommendation recommendation;

    @Schema(description = "Groups recent alerts of the same species on one camera", example = "CG_CAM-07_20240603101500")
    private String correlationGroup;

    @Schema(description = "Earlier alert in the same group this one repeats; null when original", example = "ALT-DET-000120")
    private String duplicateOf;

    @Schema(description = "Creation time, epoch milliseconds")
    private long createdAt;

    private boolean acknowledged;

    private long acknowledgedAt;

    private boolean resolved;

    @Schema(description = "Resolution time, epoch milliseconds; 0 while unresolved")
    private long resolvedAt;
}
