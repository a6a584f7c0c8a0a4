package com.wildcam.alerts.engine;

import com.wildcam.alerts.config.AlertEngineProperties;
import com.wildcam.alerts.config.MetricsConfig;
import com.wildcam.alerts.exception.InvalidDetectionException;
import com.wildcam.alerts.model.AlertEvaluation;
import com.wildcam.alerts.model.DetectionEvent;
import com.wildcam.alerts.model.FalsePositivePrediction;
import com.wildcam.alerts.model.FeatureVector;
import com.wildcam.alerts.model.Recommendation;
import com.wildcam.alerts.model.Severity;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;

/**
 * Combines pattern matching, the severity table, weather conditions and time of
 * day into a single evaluation. Holds no state of its own.
 */
@Component
public class AlertEvaluationEngine {

    private static final Logger log = LoggerFactory.getLogger(AlertEvaluationEngine.class);

    private final PatternMatcher patternMatcher;
    private final PriorityAssigner priorityAssigner;
    private final AlertEngineProperties.Environment environment;
    private final MetricsConfig metricsConfig;

    public AlertEvaluationEngine(PatternMatcher patternMatcher, PriorityAssigner priorityAssigner,
                                 AlertEngineProperties properties, MetricsConfig metricsConfig) {
        this.patternMatcher = patternMatcher;
        this.priorityAssigner = priorityAssigner;
        this.environment = properties.getEnvironment();
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "alert.evaluate", contextualName = "evaluate-detection")
    public AlertEvaluation evaluateAlert(DetectionEvent detection) {
        validate(detection);

        // Step 1: Feature extraction (rejects bad timestamps)
        FeatureVector features = FeatureExtractor.extract(detection);

        // Step 2: False-positive prediction from learned patterns
        FalsePositivePrediction prediction = patternMatcher.predictFalsePositive(features);

        // Step 3: Severity tier
        Severity priority = priorityAssigner.calculatePriority(detection, prediction.confidence());

        // Step 4: Environmental suppression
        boolean shouldFilter = shouldFilterByEnvironment(detection.getWeather());
        if (shouldFilter && !environment.isSuppressEmergency()
                && priority == Severity.EMERGENCY && !prediction.falsePositive()) {
            log.info("Keeping EMERGENCY detection {} despite environmental conditions", detection.getDetectionId());
            shouldFilter = false;
        }

        // Step 5: Temporal significance
        int hour = FeatureExtractor.parseTimestamp(detection.getTimestamp()).atZone(ZoneOffset.UTC).getHour();
        double temporalScore = temporalScore(hour);

        // Step 6: Recommendation
        Recommendation recommendation = recommend(prediction.falsePositive(), priority, shouldFilter, temporalScore);

        metricsConfig.recordEvaluation(priority.name(), recommendation.name(), prediction.confidence());
        log.debug("Evaluated detection {}: species={}, priority={}, fp={}, filter={}, recommendation={}",
                detection.getDetectionId(), detection.getSpecies(), priority,
                prediction.falsePositive(), shouldFilter, recommendation);

        return AlertEvaluation.builder()
                .detectionId(detection.getDetectionId())
                .mlConfidence(prediction.confidence())
                .falsePositive(prediction.falsePositive())
                .priority(priority)
                .shouldFilter(shouldFilter)
                .temporalScore(temporalScore)
                .recommendation(recommendation)
                .build();
    }

    public boolean shouldFilterByEnvironment(DetectionEvent.WeatherContext weather) {
        return weather.getTemperature() < environment.getMinTemperature()
                || weather.getTemperature() > environment.getMaxTemperature()
                || weather.getWindSpeed() > environment.getMaxWindSpeed()
                || weather.getVisibility() < environment.getMinVisibility();
    }

    /**
     * Dawn and dusk score highest, midday lowest, night in between.
     */
    public static double temporalScore(int hour) {
        if ((hour >= 5 && hour <= 8) || (hour >= 17 && hour <= 20)) {
            return 0.9;
        }
        if (hour >= 9 && hour <= 16) {
            return 0.5;
        }
        return 0.7;
    }

    public static Recommendation recommend(boolean falsePositive, Severity priority,
                                           boolean shouldFilter, double temporalScore) {
        if (falsePositive && shouldFilter) return Recommendation.SUPPRESS;
        if (falsePositive) return Recommendation.REVIEW;
        if (priority == Severity.EMERGENCY) return Recommendation.IMMEDIATE_ACTION;
        if (priority == Severity.CRITICAL && temporalScore > 0.7) return Recommendation.ALERT;
        if (shouldFilter) return Recommendation.QUEUE;
        if (temporalScore < 0.3) return Recommendation.LOG;
        return Recommendation.NOTIFY;
    }

    private static void validate(DetectionEvent detection) {
        if (detection == null) {
            throw new InvalidDetectionException("Detection payload is required");
        }
        if (detection.getSpecies() == null || detection.getSpecies().isBlank()) {
            throw new InvalidDetectionException("Detection species is required");
        }
        if (Double.isNaN(detection.getConfidence())
                || detection.getConfidence() < 0.0 || detection.getConfidence() > 1.0) {
            throw new InvalidDetectionException("Detection confidence must be within [0, 1]: " + detection.getConfidence());
        }
    }
}
