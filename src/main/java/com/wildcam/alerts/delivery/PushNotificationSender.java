package com.wildcam.alerts.delivery;

import com.wildcam.alerts.model.Alert;
import com.wildcam.alerts.model.DeliveryChannel;
import com.wildcam.alerts.model.DeliveryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Push delivery to a user's registered devices. Logs only; device registration
 * lives outside this service.
 */
@Component
public class PushNotificationSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(PushNotificationSender.class);

    @Override
    public DeliveryChannel getSupportedChannel() {
        return DeliveryChannel.PUSH;
    }

    @Override
    public DeliveryResult send(Alert alert, String userId) {
        log.info("Push notification for alert={} to user={}: {} [{}]",
                alert.getAlertId(), userId, alert.getTitle(), alert.getPriority());
        return DeliveryResult.success(alert.getAlertId(), DeliveryChannel.PUSH, userId, 1);
    }
}
