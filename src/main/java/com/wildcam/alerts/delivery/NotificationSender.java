package com.wildcam.alerts.delivery;

import com.wildcam.alerts.model.Alert;
import com.wildcam.alerts.model.DeliveryChannel;
import com.wildcam.alerts.model.DeliveryResult;

/**
 * Strategy interface for delivery channels.
 * Each implementation handles exactly one {@link DeliveryChannel}.
 */
public interface NotificationSender {

    DeliveryChannel getSupportedChannel();

    /**
     * Deliver the alert to one target (address, user id, URL or phone number).
     * Failures are reported in the result, never thrown.
     */
    DeliveryResult send(Alert alert, String target);
}
