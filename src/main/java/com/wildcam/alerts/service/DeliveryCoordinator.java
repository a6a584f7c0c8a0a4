package com.wildcam.alerts.service;

import com.aerospike.client.AerospikeException;
import com.wildcam.alerts.config.DeliveryProperties;
import com.wildcam.alerts.model.Alert;
import com.wildcam.alerts.model.AlertRule;
import com.wildcam.alerts.model.DeliveryChannel;
import com.wildcam.alerts.model.DetectionEvent;
import com.wildcam.alerts.model.ProcessingOutcome;
import com.wildcam.alerts.repository.AlertRuleRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for detection ingestion and rule-based notification fan-out.
 *
 * Alert creation runs on the caller's thread. Rule matching and channel jobs run
 * on the delivery executor; each (channel, target) pair becomes its own job.
 */
@Service
public class DeliveryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DeliveryCoordinator.class);

    private final AlertService alertService;
    private final AlertRuleRepository ruleRepository;
    private final ChannelDeliveryJob deliveryJob;
    private final TaskExecutor deliveryExecutor;
    private final DeliveryProperties properties;
    private final Clock clock;

    public DeliveryCoordinator(AlertService alertService,
                               AlertRuleRepository ruleRepository,
                               ChannelDeliveryJob deliveryJob,
                               @Qualifier("deliveryExecutor") TaskExecutor deliveryExecutor,
                               DeliveryProperties properties,
                               Clock clock) {
        this.alertService = alertService;
        this.ruleRepository = ruleRepository;
        this.deliveryJob = deliveryJob;
        this.deliveryExecutor = deliveryExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    @Observed(name = "detection.process", contextualName = "process-detection")
    public ProcessingOutcome processDetectionAlert(DetectionEvent detection) {
        Alert alert;
        try {
            Alert existing = alertService.findExistingAlert(detection);
            if (existing != null) {
                log.info("Detection {} replayed, alert {} already processed; no new deliveries",
                        detection.getDetectionId(), existing.getAlertId());
                return existing.isFiltered()
                        ? ProcessingOutcome.filtered(existing.getAlertId(), existing.getFilterReason())
                        : ProcessingOutcome.success(existing.getAlertId());
            }
            alert = alertService.createAlert(detection);
        } catch (AerospikeException e) {
            log.error("Failed to persist alert for detection {}: {}", detection.getDetectionId(), e.getMessage(), e);
            return ProcessingOutcome.failed("Persistence failure: " + e.getMessage());
        }

        if (alert.isFiltered()) {
            return ProcessingOutcome.filtered(alert.getAlertId(), alert.getFilterReason());
        }

        deliveryExecutor.execute(() -> deliverAlertNotifications(alert));
        return ProcessingOutcome.success(alert.getAlertId());
    }

    /**
     * Match the alert against active global and camera rules and start one
     * delivery job per distinct (channel, target).
     *
     * @return number of delivery jobs started
     */
    public int deliverAlertNotifications(Alert alert) {
        if (alert.isFiltered()) {
            log.debug("Alert {} is filtered, no notifications", alert.getAlertId());
            return 0;
        }

        Instant now = clock.instant();
        Set<Map.Entry<DeliveryChannel, String>> jobs = new LinkedHashSet<>();
        for (AlertRule rule : applicableRules(alert)) {
            if (!shouldSendAlert(alert, rule, now)) {
                continue;
            }
            if (rule.isEmailEnabled()) {
                String address = rule.getEmailAddress() != null ? rule.getEmailAddress() : rule.getUserId();
                jobs.add(new SimpleImmutableEntry<>(DeliveryChannel.EMAIL, address));
            }
            if (rule.isPushEnabled()) {
                jobs.add(new SimpleImmutableEntry<>(DeliveryChannel.PUSH, rule.getUserId()));
            }
            if (rule.getWebhookUrl() != null && !rule.getWebhookUrl().isBlank()) {
                jobs.add(new SimpleImmutableEntry<>(DeliveryChannel.WEBHOOK, rule.getWebhookUrl()));
            }
            if (rule.isSmsEnabled() && rule.getPhoneNumber() != null && !rule.getPhoneNumber().isBlank()) {
                jobs.add(new SimpleImmutableEntry<>(DeliveryChannel.SMS, rule.getPhoneNumber()));
            }
        }

        for (Map.Entry<DeliveryChannel, String> job : jobs) {
            deliveryJob.execute(alert.getAlertId(), job.getKey(), job.getValue());
        }

        log.info("Alert {} matched rules, {} delivery jobs started", alert.getAlertId(), jobs.size());
        return jobs.size();
    }

    public boolean shouldSendAlert(Alert alert, AlertRule rule, Instant now) {
        if (!rule.getSeverityLevels().isEmpty() && !rule.getSeverityLevels().contains(alert.getSeverity())) {
            return false;
        }
        if (!rule.getSpeciesFilter().isEmpty() && !rule.getSpeciesFilter().contains(alert.getSpecies())) {
            return false;
        }
        if (alert.getMlConfidence() < rule.getMinConfidence()) {
            return false;
        }

        ZonedDateTime utc = now.atZone(ZoneOffset.UTC);
        if (!rule.getTimeOfDay().isEmpty() && !rule.getTimeOfDay().contains(utc.getHour())) {
            return false;
        }
        if (!rule.getDaysOfWeek().isEmpty() && !rule.getDaysOfWeek().contains(utc.getDayOfWeek())) {
            return false;
        }

        return !(rule.isSuppressFalsePositives()
                && alert.getFalsePositiveScore() > properties.getFalsePositiveSuppression());
    }

    @Scheduled(fixedRateString = "${alerts.rule-cache-refresh-seconds:60}", timeUnit = TimeUnit.SECONDS)
    public void refreshRuleCache() {
        ruleRepository.refreshCache();
    }

    private List<AlertRule> applicableRules(Alert alert) {
        Map<String, AlertRule> byId = new LinkedHashMap<>();
        for (AlertRule rule : ruleRepository.findActiveGlobal()) {
            byId.putIfAbsent(rule.getRuleId(), rule);
        }
        for (AlertRule rule : ruleRepository.findActiveForCamera(alert.getCameraId())) {
            byId.putIfAbsent(rule.getRuleId(), rule);
        }
        return new ArrayList<>(byId.values());
    }
}
