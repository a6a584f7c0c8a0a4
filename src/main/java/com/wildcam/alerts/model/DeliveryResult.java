package com.wildcam.alerts.model;

import lombok.Builder;
import lombok.Value;

/**
 * Final outcome of one channel delivery job.
 */
@Value
@Builder
public class DeliveryResult {
    String alertId;
    DeliveryChannel channel;
    String target;
    DeliveryStatus status;
    int attempts;
    String lastError;

    public boolean isSuccess() {
        return status == DeliveryStatus.SUCCESS;
    }

    public static DeliveryResult success(String alertId, DeliveryChannel channel, String target, int attempts) {
        return DeliveryResult.builder()
                .alertId(alertId).channel(channel).target(target)
                .status(DeliveryStatus.SUCCESS).attempts(attempts)
                .build();
    }

    public static DeliveryResult failed(String alertId, DeliveryChannel channel, String target,
                                        int attempts, String lastError) {
        return DeliveryResult.builder()
                .alertId(alertId).channel(channel).target(target)
                .status(DeliveryStatus.FAILED).attempts(attempts).lastError(lastError)
                .build();
    }

    public static DeliveryResult skipped(String alertId, DeliveryChannel channel, String target, String reason) {
        return DeliveryResult.builder()
                .alertId(alertId).channel(channel).target(target)
                .status(DeliveryStatus.SKIPPED).attempts(0).lastError(reason)
                .build();
    }
}
