package com.wildcam.alerts.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wildcam.alerts.config.AlertEngineProperties;
import com.wildcam.alerts.config.MetricsConfig;
import com.wildcam.alerts.engine.AlertEvaluationEngine;
import com.wildcam.alerts.engine.AnomalyDetector;
import com.wildcam.alerts.engine.FeatureExtractor;
import com.wildcam.alerts.engine.Forecaster;
import com.wildcam.alerts.engine.PatternMatcher;
import com.wildcam.alerts.exception.AlertNotFoundException;
import com.wildcam.alerts.exception.InvalidDetectionException;
import com.wildcam.alerts.model.ActivityForecast;
import com.wildcam.alerts.model.Alert;
import com.wildcam.alerts.model.AlertEvaluation;
import com.wildcam.alerts.model.AnomalyResult;
import com.wildcam.alerts.model.DeliveryRecord;
import com.wildcam.alerts.model.DetectionEvent;
import com.wildcam.alerts.model.Severity;
import com.wildcam.alerts.repository.AlertRepository;
import com.wildcam.alerts.repository.DeliveryRecordRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Turns evaluated detections into persisted alerts and applies user feedback.
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private static final DateTimeFormatter GROUP_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private final AlertEvaluationEngine evaluationEngine;
    private final PatternMatcher patternMatcher;
    private final AnomalyDetector anomalyDetector;
    private final Forecaster forecaster;
    private final AlertRepository alertRepository;
    private final DeliveryRecordRepository deliveryRecordRepository;
    private final MetricsAggregationService metricsAggregationService;
    private final AlertEngineProperties.Filtering filtering;
    private final AlertEngineProperties.Correlation correlation;
    private final MetricsConfig metricsConfig;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AlertService(AlertEvaluationEngine evaluationEngine,
                        PatternMatcher patternMatcher,
                        AnomalyDetector anomalyDetector,
                        Forecaster forecaster,
                        AlertRepository alertRepository,
                        DeliveryRecordRepository deliveryRecordRepository,
                        MetricsAggregationService metricsAggregationService,
                        AlertEngineProperties properties,
                        MetricsConfig metricsConfig,
                        ObjectMapper objectMapper,
                        Clock clock) {
        this.evaluationEngine = evaluationEngine;
        this.patternMatcher = patternMatcher;
        this.anomalyDetector = anomalyDetector;
        this.forecaster = forecaster;
        this.alertRepository = alertRepository;
        this.deliveryRecordRepository = deliveryRecordRepository;
        this.metricsAggregationService = metricsAggregationService;
        this.filtering = properties.getFiltering();
        this.correlation = properties.getCorrelation();
        this.metricsConfig = metricsConfig;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Evaluate, build, filter and persist an alert for the detection, then fold the
     * detection into the species' activity history.
     * <p>
     * A detection that already has an alert is returned as stored, with no
     * re-evaluation, history update or counter change.
     *
     * @throws InvalidDetectionException if the detection cannot be evaluated
     */
    @Observed(name = "alert.create", contextualName = "create-alert")
    public Alert createAlert(DetectionEvent detection) {
        Alert existing = findExistingAlert(detection);
        if (existing != null) {
            log.info("Detection {} already has alert {}, returning it unchanged",
                    detection.getDetectionId(), existing.getAlertId());
            return existing;
        }

        // Step 1: Evaluate (validates the detection)
        AlertEvaluation evaluation = evaluationEngine.evaluateAlert(detection);
        Instant detectedAt = FeatureExtractor.parseTimestamp(detection.getTimestamp());
        String species = detection.getSpecies();

        // Step 2: Activity side inputs
        AnomalyResult anomaly = anomalyDetector.detectAnomaly(species, detectedAt);
        ActivityForecast forecast = forecaster.forecastActivity(species, detectedAt);

        // Step 3: Build alert
        Severity severity = evaluation.getPriority();
        Alert alert = Alert.builder()
                .alertId(alertIdFor(detection))
                .detectionId(detection.getDetectionId())
                .cameraId(detection.getCameraId())
                .species(species)
                .severity(severity)
                .priority(severity.getPriority())
                .title(generateTitle(detection, severity))
                .message(generateMessage(detection, evaluation, anomaly))
                .data(buildData(detection, anomaly, forecast))
                .mlConfidence(evaluation.getMlConfidence())
                .falsePositiveScore(evaluation.isFalsePositive() ? 1.0 : 0.0)
                .anomalyScore(anomaly.getAnomalyScore())
                .temporalScore(evaluation.getTemporalScore())
                .recommendation(evaluation.getRecommendation())
                .createdAt(clock.millis())
                .build();

        // Step 4: Filtering
        if (shouldFilterAlert(alert, evaluation)) {
            alert.setFiltered(true);
            alert.setFilterReason(evaluation.getRecommendation().toDisplayString());
            metricsConfig.recordFiltered(evaluation.getRecommendation().name());
            log.info("Alert {} filtered: {}", alert.getAlertId(), alert.getFilterReason());
        }

        // Step 5: Correlate with recent alerts
        assignCorrelation(alert);

        // Step 6: Persist, then update activity history
        alertRepository.save(alert);
        anomalyDetector.recordDetection(species, detectedAt, detection.getConfidence());

        // Step 7: Daily counters (non-critical)
        try {
            metricsAggregationService.recordAlertCreated(alert);
        } catch (Exception e) {
            log.warn("Failed to update daily counters for alert {}: {}", alert.getAlertId(), e.getMessage());
        }

        log.info("Alert {} created: species={}, severity={}, priority={}, filtered={}",
                alert.getAlertId(), species, severity, alert.getPriority(), alert.isFiltered());
        return alert;
    }

    /**
     * The stored alert for a detection id, or null when the detection is new or
     * carries no id.
     */
    public Alert findExistingAlert(DetectionEvent detection) {
        if (detection == null || detection.getDetectionId() == null || detection.getDetectionId().isBlank()) {
            return null;
        }
        return alertRepository.findById(alertIdFor(detection));
    }

    /**
     * Store user feedback on the alert and teach the pattern matcher with the
     * detection's features.
     */
    public Alert processFeedback(String alertId, boolean falsePositive) {
        Alert alert = getAlert(alertId);
        alert.setUserFalsePositive(falsePositive);
        alertRepository.save(alert);

        try {
            DetectionEvent detection = objectMapper.convertValue(alert.getData(), DetectionEvent.class);
            patternMatcher.learnFromFeedback(FeatureExtractor.extract(detection), falsePositive);
        } catch (IllegalArgumentException | InvalidDetectionException e) {
            log.warn("Feedback for alert {} stored but not learned, detection context unusable: {}",
                    alertId, e.getMessage());
        }

        log.info("Processed feedback for alert {}: falsePositive={}", alertId, falsePositive);
        return alert;
    }

    public Alert acknowledge(String alertId) {
        Alert alert = getAlert(alertId);
        if (!alert.isAcknowledged()) {
            alert.setAcknowledged(true);
            alert.setAcknowledgedAt(clock.millis());
            alertRepository.save(alert);
        }
        return alert;
    }

    public Alert resolve(String alertId) {
        Alert alert = getAlert(alertId);
        if (!alert.isResolved()) {
            alert.setResolved(true);
            alert.setResolvedAt(clock.millis());
            alertRepository.save(alert);
        }
        return alert;
    }

    public Alert getAlert(String alertId) {
        Alert alert = alertRepository.findById(alertId);
        if (alert == null) {
            throw new AlertNotFoundException(alertId);
        }
        return alert;
    }

    /**
     * Per-channel delivery outcomes for an alert, oldest first.
     *
     * @throws AlertNotFoundException if the alert does not exist
     */
    public List<DeliveryRecord> getDeliveries(String alertId) {
        getAlert(alertId);
        return deliveryRecordRepository.findByAlertId(alertId);
    }

    public List<Alert> getActiveAlerts(String cameraId, Severity severity, int limit) {
        return alertRepository.findActive(cameraId, severity, limit);
    }

    boolean shouldFilterAlert(Alert alert, AlertEvaluation evaluation) {
        if (evaluation.isFalsePositive() && alert.getFalsePositiveScore() > filtering.getFalsePositiveScore()) {
            return true;
        }
        if (evaluation.isShouldFilter()) {
            return true;
        }
        return alert.getSeverity() == Severity.INFO && alert.getMlConfidence() < filtering.getInfoMinConfidence();
    }

    /**
     * Join the newest correlation group among recent alerts of the same camera and
     * species, or open a new one. Inside the group, the earliest alert within the
     * duplicate window that is not itself a duplicate becomes {@code duplicateOf}.
     */
    void assignCorrelation(Alert alert) {
        if (alert.getCameraId() == null || alert.getDetectionId() == null) {
            return;
        }
        long now = alert.getCreatedAt();
        long since = now - Duration.ofMinutes(correlation.getWindowMinutes()).toMillis();
        List<Alert> recent = alertRepository.findRecent(alert.getCameraId(), alert.getSpecies(), since).stream()
                .filter(other -> !alert.getAlertId().equals(other.getAlertId()))
                .toList();

        String group = recent.stream()
                .map(Alert::getCorrelationGroup)
                .filter(Objects::nonNull)
                .findFirst()
                .orElseGet(() -> "CG_" + alert.getCameraId() + "_" + GROUP_STAMP.format(Instant.ofEpochMilli(now)));
        alert.setCorrelationGroup(group);

        long duplicateSince = now - Duration.ofMinutes(correlation.getDuplicateWindowMinutes()).toMillis();
        recent.stream()
                .filter(other -> group.equals(other.getCorrelationGroup()))
                .filter(other -> other.getDuplicateOf() == null)
                .filter(other -> other.getCreatedAt() >= duplicateSince)
                .min(Comparator.comparingLong(Alert::getCreatedAt))
                .ifPresent(original -> {
                    alert.setDuplicateOf(original.getAlertId());
                    log.info("Alert {} marked as duplicate of {}", alert.getAlertId(), original.getAlertId());
                });
    }

    // Stable per detection so a redelivered detection maps to its existing alert
    private static String alertIdFor(DetectionEvent detection) {
        if (detection.getDetectionId() != null && !detection.getDetectionId().isBlank()) {
            return "ALT-" + detection.getDetectionId();
        }
        return "ALT-" + UUID.randomUUID();
    }

    static String generateTitle(DetectionEvent detection, Severity severity) {
        String species = detection.getSpecies();
        return switch (severity) {
            case EMERGENCY -> String.format("EMERGENCY: %s detected with %.1f%% confidence",
                    species, detection.getConfidence() * 100.0);
            case CRITICAL -> "CRITICAL: " + species + " detected";
            case WARNING -> "Wildlife Alert: " + species;
            case INFO -> "Detection: " + species;
        };
    }

    static String generateMessage(DetectionEvent detection, AlertEvaluation evaluation, AnomalyResult anomaly) {
        String location = detection.getLocationName() != null ? detection.getLocationName() : "Unknown location";
        StringBuilder message = new StringBuilder();
        message.append(String.format("%s detected at %s with %.1f%% confidence.%n%n",
                detection.getSpecies(), location, detection.getConfidence() * 100.0));
        message.append(String.format("ML Confidence: %.1f%%%n", evaluation.getMlConfidence() * 100.0));
        message.append("Recommendation: ").append(evaluation.getRecommendation().toDisplayString()).append("\n\n");

        if (anomaly.isAnomaly()) {
            message.append("Anomaly detected: ").append(anomaly.getAnomalyType()).append('\n');
            message.append(String.format("Anomaly score: %.2f%n%n", anomaly.getAnomalyScore()));
        }

        if (evaluation.getTemporalScore() > 0.8) {
            message.append("High activity period for this species\n");
        } else if (evaluation.getTemporalScore() < 0.3) {
            message.append("Unusual time for this species\n");
        }
        return message.toString();
    }

    private Map<String, Object> buildData(DetectionEvent detection, AnomalyResult anomaly, ActivityForecast forecast) {
        Map<String, Object> data = new LinkedHashMap<>(
                objectMapper.convertValue(detection, new TypeReference<Map<String, Object>>() {}));

        Map<String, Object> anomalyInfo = new LinkedHashMap<>();
        anomalyInfo.put("type", anomaly.getAnomalyType().name());
        anomalyInfo.put("anomaly", anomaly.isAnomaly());
        anomalyInfo.put("zScore", anomaly.getZScore());
        anomalyInfo.put("currentCount", anomaly.getCurrentCount());
        anomalyInfo.put("baselineMean", anomaly.getBaselineMean());
        data.put("anomalyInfo", anomalyInfo);

        if (forecast.isHasForecast()) {
            Map<String, Object> forecastInfo = new LinkedHashMap<>();
            forecastInfo.put("hour", forecast.getHour());
            forecastInfo.put("expectedCount", forecast.getExpectedCount());
            forecastInfo.put("lowerBound", forecast.getLowerBound());
            forecastInfo.put("upperBound", forecast.getUpperBound());
            data.put("forecast", forecastInfo);
        }
        return data;
    }
}
