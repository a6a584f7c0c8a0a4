package com.wildcam.alerts.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * JSON body POSTed to user webhooks.
 */
@Value
@Builder
public class WebhookPayload {

    @JsonProperty("alert_id")
    String alertId;

    @JsonProperty("alert_type")
    String alertType;

    String severity;

    String priority;

    String title;

    String message;

    @JsonProperty("camera_id")
    String cameraId;

    @JsonProperty("detection_id")
    String detectionId;

    @JsonProperty("ml_confidence")
    double mlConfidence;

    @JsonProperty("anomaly_score")
    double anomalyScore;

    String timestamp;

    Map<String, Object> data;

    public static WebhookPayload from(Alert alert) {
        return WebhookPayload.builder()
                .alertId(alert.getAlertId())
                .alertType(alert.getAlertType())
                .severity(alert.getSeverity() != null ? alert.getSeverity().getValue() : null)
                .priority(alert.getPriority())
                .title(alert.getTitle())
                .message(alert.getMessage())
                .cameraId(alert.getCameraId())
                .detectionId(alert.getDetectionId())
                .mlConfidence(alert.getMlConfidence())
                .anomalyScore(alert.getAnomalyScore())
                .timestamp(alert.getCreatedAt() > 0 ? Instant.ofEpochMilli(alert.getCreatedAt()).toString() : null)
                .data(alert.getData())
                .build();
    }
}
