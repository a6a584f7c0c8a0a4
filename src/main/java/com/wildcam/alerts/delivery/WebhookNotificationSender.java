package com.wildcam.alerts.delivery;

import com.wildcam.alerts.config.DeliveryProperties;
import com.wildcam.alerts.config.MetricsConfig;
import com.wildcam.alerts.model.Alert;
import com.wildcam.alerts.model.DeliveryChannel;
import com.wildcam.alerts.model.DeliveryResult;
import com.wildcam.alerts.model.WebhookPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * POSTs the alert payload to a user webhook, retrying sequentially within the
 * calling job until the attempt budget is spent.
 */
@Component
public class WebhookNotificationSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationSender.class);

    private final WebhookClient webhookClient;
    private final RetryPolicy retryPolicy;
    private final MetricsConfig metricsConfig;

    @Autowired
    public WebhookNotificationSender(WebhookClient webhookClient, DeliveryProperties properties,
                                     MetricsConfig metricsConfig) {
        this(webhookClient, RetryPolicy.from(properties.getWebhook()), metricsConfig);
    }

    public WebhookNotificationSender(WebhookClient webhookClient, RetryPolicy retryPolicy,
                                     MetricsConfig metricsConfig) {
        this.webhookClient = webhookClient;
        this.retryPolicy = retryPolicy;
        this.metricsConfig = metricsConfig;
    }

    @Override
    public DeliveryChannel getSupportedChannel() {
        return DeliveryChannel.WEBHOOK;
    }

    @Override
    public DeliveryResult send(Alert alert, String url) {
        WebhookPayload payload = WebhookPayload.from(alert);
        String lastError = null;
        int attempt = 0;

        while (attempt < retryPolicy.maxAttempts()) {
            attempt++;
            AttemptOutcome outcome = webhookClient.post(url, payload);
            metricsConfig.recordWebhookAttempt(outcome.kind().name());

            switch (outcome.kind()) {
                case SUCCESS -> {
                    log.info("Webhook delivered for alert={} to {} on attempt {} (status {})",
                            alert.getAlertId(), url, attempt, outcome.statusCode());
                    return DeliveryResult.success(alert.getAlertId(), DeliveryChannel.WEBHOOK, url, attempt);
                }
                case FATAL_FAILURE -> {
                    log.error("Webhook delivery for alert={} cannot succeed: {}", alert.getAlertId(), outcome.detail());
                    return DeliveryResult.failed(alert.getAlertId(), DeliveryChannel.WEBHOOK, url,
                            attempt, outcome.detail());
                }
                case RETRYABLE_FAILURE -> {
                    lastError = outcome.detail();
                    log.warn("Webhook attempt {}/{} failed for alert={} to {}: {}",
                            attempt, retryPolicy.maxAttempts(), alert.getAlertId(), url, lastError);
                    if (attempt < retryPolicy.maxAttempts() && !pause()) {
                        return DeliveryResult.failed(alert.getAlertId(), DeliveryChannel.WEBHOOK, url,
                                attempt, "Interrupted during backoff after: " + lastError);
                    }
                }
            }
        }

        log.error("Webhook delivery failed for alert={} to {} after {} attempts: {}",
                alert.getAlertId(), url, attempt, lastError);
        return DeliveryResult.failed(alert.getAlertId(), DeliveryChannel.WEBHOOK, url, attempt, lastError);
    }

    private boolean pause() {
        if (retryPolicy.backoffMillis() <= 0) {
            return true;
        }
        try {
            Thread.sleep(retryPolicy.backoffMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
