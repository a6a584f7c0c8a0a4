package com.wildcam.alerts.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Daily alert counters and accuracy for one camera")
public class AlertMetrics {

    @Schema(description = "UTC date, ISO format", example = "2024-06-01")
    private String date;

    private String cameraId;

    private long totalAlerts;
    private long filteredAlerts;
    private long sentAlerts;
    private long falsePositiveCount;

    // Recomputed by the daily aggregation job from user feedback
    private double mlAccuracy;
    private double falsePositiveRate;
    private long feedbackCount;

    public String key() {
        return keyOf(cameraId, date);
    }

    public static String keyOf(String cameraId, String date) {
        return cameraId + ":" + date;
    }
}
