package com.wildcam.alerts.service;

import com.wildcam.alerts.config.MetricsConfig;
import com.wildcam.alerts.delivery.NotificationSender;
import com.wildcam.alerts.model.Alert;
import com.wildcam.alerts.model.DeliveryChannel;
import com.wildcam.alerts.model.DeliveryRecord;
import com.wildcam.alerts.model.DeliveryResult;
import com.wildcam.alerts.repository.AlertRepository;
import com.wildcam.alerts.repository.DeliveryRecordRepository;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * One delivery of one alert over one channel to one target. Reads the alert,
 * never modifies it, and records the outcome under a deterministic key so that
 * running the same job twice leaves a single delivery record.
 */
@Component
public class ChannelDeliveryJob {

    private static final Logger log = LoggerFactory.getLogger(ChannelDeliveryJob.class);

    private final AlertRepository alertRepository;
    private final DeliveryRecordRepository deliveryRecordRepository;
    private final Map<DeliveryChannel, NotificationSender> senders;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ChannelDeliveryJob(AlertRepository alertRepository,
                              DeliveryRecordRepository deliveryRecordRepository,
                              List<NotificationSender> senderList,
                              Tracer tracer,
                              MetricsConfig metricsConfig,
                              Clock clock) {
        this.alertRepository = alertRepository;
        this.deliveryRecordRepository = deliveryRecordRepository;
        this.senders = new EnumMap<>(DeliveryChannel.class);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
        this.clock = clock;

        for (NotificationSender sender : senderList) {
            senders.put(sender.getSupportedChannel(), sender);
            log.info("Registered notification sender: {} -> {}",
                    sender.getSupportedChannel(), sender.getClass().getSimpleName());
        }
    }

    @Async("deliveryExecutor")
    public CompletableFuture<DeliveryResult> execute(String alertId, DeliveryChannel channel, String target) {
        return CompletableFuture.completedFuture(run(alertId, channel, target));
    }

    public DeliveryResult run(String alertId, DeliveryChannel channel, String target) {
        Span span = tracer.nextSpan()
                .name("delivery." + channel.name().toLowerCase(Locale.ROOT))
                .tag("alert.id", alertId)
                .tag("delivery.channel", channel.name())
                .start();

        DeliveryResult result;
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            result = deliver(alertId, channel, target);
            span.tag("delivery.status", result.getStatus().name());
            span.tag("delivery.attempts", String.valueOf(result.getAttempts()));
        } catch (Exception e) {
            span.error(e);
            log.error("Delivery job failed for alert={} channel={}: {}", alertId, channel, e.getMessage(), e);
            result = DeliveryResult.failed(alertId, channel, target, 0, e.getMessage());
        } finally {
            span.end();
        }

        metricsConfig.recordNotification(channel.name().toLowerCase(Locale.ROOT),
                result.getStatus().name().toLowerCase(Locale.ROOT));
        persist(result);
        return result;
    }

    private DeliveryResult deliver(String alertId, DeliveryChannel channel, String target) {
        Alert alert = alertRepository.findById(alertId);
        if (alert == null) {
            log.warn("Alert {} no longer exists, skipping {} delivery", alertId, channel);
            return DeliveryResult.skipped(alertId, channel, target, "Alert not found");
        }

        NotificationSender sender = senders.get(channel);
        if (sender == null) {
            log.warn("No sender registered for channel {}, alert {}", channel, alertId);
            return DeliveryResult.skipped(alertId, channel, target, "No sender for channel");
        }

        return sender.send(alert, target);
    }

    private void persist(DeliveryResult result) {
        try {
            deliveryRecordRepository.save(DeliveryRecord.from(result, clock.millis()));
        } catch (Exception e) {
            log.error("Failed to record {} delivery outcome for alert={}: {}",
                    result.getChannel(), result.getAlertId(), e.getMessage(), e);
        }
    }
}
