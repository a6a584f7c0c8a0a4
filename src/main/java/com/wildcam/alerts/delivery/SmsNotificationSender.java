package com.wildcam.alerts.delivery;

import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import com.wildcam.alerts.config.TwilioNotificationConfig;
import com.wildcam.alerts.model.Alert;
import com.wildcam.alerts.model.DeliveryChannel;
import com.wildcam.alerts.model.DeliveryResult;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SmsNotificationSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(SmsNotificationSender.class);

    private final TwilioNotificationConfig config;

    public SmsNotificationSender(TwilioNotificationConfig config) {
        this.config = config;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio SMS sender initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio SMS sender is DISABLED.");
        }
    }

    @Override
    public DeliveryChannel getSupportedChannel() {
        return DeliveryChannel.SMS;
    }

    @Override
    @Observed(name = "notification.sms", contextualName = "send-sms")
    public DeliveryResult send(Alert alert, String phoneNumber) {
        if (!config.isEnabled()) {
            return DeliveryResult.skipped(alert.getAlertId(), DeliveryChannel.SMS, phoneNumber, "Twilio disabled");
        }

        try {
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(phoneNumber)),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    buildMessageBody(alert)
            ).create();
            log.info("SMS sent for alert={}, sid={}", alert.getAlertId(), message.getSid());
            return DeliveryResult.success(alert.getAlertId(), DeliveryChannel.SMS, phoneNumber, 1);
        } catch (Exception e) {
            log.error("Failed to send SMS for alert={}: {}", alert.getAlertId(), e.getMessage(), e);
            return DeliveryResult.failed(alert.getAlertId(), DeliveryChannel.SMS, phoneNumber, 1, e.getMessage());
        }
    }

    String buildMessageBody(Alert alert) {
        return String.format(
                "[%s] %s\n" +
                "Camera: %s\n" +
                "Species: %s\n" +
                "Alert ID: %s",
                alert.getSeverity() != null ? alert.getSeverity().name() : "ALERT",
                alert.getTitle(),
                alert.getCameraId(),
                alert.getSpecies(),
                alert.getAlertId()
        );
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
