package com.wildcam.alerts.delivery;

import com.wildcam.alerts.model.Alert;
import com.wildcam.alerts.model.DeliveryChannel;
import com.wildcam.alerts.model.DeliveryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Log-only email sender; every delivery is reported as successful. */
@Component
public class EmailNotificationSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(EmailNotificationSender.class);

    @Override
    public DeliveryChannel getSupportedChannel() {
        return DeliveryChannel.EMAIL;
    }

    @Override
    public DeliveryResult send(Alert alert, String address) {
        log.info("Email notification for alert={} to {}: {}", alert.getAlertId(), address, alert.getTitle());
        return DeliveryResult.success(alert.getAlertId(), DeliveryChannel.EMAIL, address, 1);
    }
}
