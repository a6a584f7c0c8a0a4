package com.wildcam.alerts.delivery;

import com.wildcam.alerts.config.DeliveryProperties;

/**
 * Bounded sequential retry: at most {@code maxAttempts} attempts with a fixed
 * pause of {@code backoffMillis} between consecutive attempts.
 */
public record RetryPolicy(int maxAttempts, long backoffMillis) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (backoffMillis < 0) {
            throw new IllegalArgumentException("backoffMillis must be >= 0, got " + backoffMillis);
        }
    }

    public static RetryPolicy from(DeliveryProperties.Webhook config) {
        return new RetryPolicy(config.getMaxAttempts(), config.getBackoffMillis());
    }
}
