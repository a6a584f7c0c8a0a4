package com.wildcam.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryRecord {
    private String alertId;
    private DeliveryChannel channel;
    private String target;
    private DeliveryStatus status;
    private int attempts;
    private String lastError;
    private long completedAt;

    /**
     * Deterministic key: re-running the same job overwrites its record.
     */
    public String key() {
        return alertId + ":" + channel.name() + ":" + Integer.toHexString(String.valueOf(target).hashCode());
    }

    public static DeliveryRecord from(DeliveryResult result, long completedAt) {
        return DeliveryRecord.builder()
                .alertId(result.getAlertId())
                .channel(result.getChannel())
                .target(result.getTarget())
                .status(result.getStatus())
                .attempts(result.getAttempts())
                .lastError(result.getLastError())
                .completedAt(completedAt)
                .build();
    }
}
