package com.wildcam.alerts.engine;

import com.wildcam.alerts.config.AlertEngineProperties;
import com.wildcam.alerts.config.MetricsConfig;
import com.wildcam.alerts.engine.state.PatternStore;
import com.wildcam.alerts.model.FalsePositivePrediction;
import com.wildcam.alerts.model.FeatureVector;
import com.wildcam.alerts.model.PatternLabel;
import com.wildcam.alerts.model.PatternStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Predicts false positives by cosine similarity against user-labelled detections.
 *
 * Decision, using the most recent vectors of each label:
 *   avgFp > fpThreshold and avgFp > avgTp  ->  (1 - avgFp, false positive)
 *   avgTp > tpThreshold                    ->  (avgTp, genuine)
 *   otherwise                              ->  (0.5, genuine)
 */
@Component
public class PatternMatcher {

    private static final Logger log = LoggerFactory.getLogger(PatternMatcher.class);

    private final PatternStore store;
    private final AlertEngineProperties.Pattern config;
    private final MetricsConfig metricsConfig;

    public PatternMatcher(PatternStore store, AlertEngineProperties properties, MetricsConfig metricsConfig) {
        this.store = store;
        this.config = properties.getPattern();
        this.metricsConfig = metricsConfig;
    }

    public FalsePositivePrediction predictFalsePositive(FeatureVector features) {
        List<FeatureVector> fpPatterns = store.recent(PatternLabel.FALSE_POSITIVE, config.getSimilarityWindow());
        List<FeatureVector> tpPatterns = store.recent(PatternLabel.TRUE_POSITIVE, config.getSimilarityWindow());

        if (fpPatterns.isEmpty() && tpPatterns.isEmpty()) {
            return FalsePositivePrediction.neutral();
        }

        double avgFp = meanSimilarity(features, fpPatterns);
        double avgTp = meanSimilarity(features, tpPatterns);

        if (avgFp > config.getFalsePositiveSimilarity() && avgFp > avgTp) {
            return new FalsePositivePrediction(1.0 - avgFp, true);
        }
        if (avgTp > config.getTruePositiveSimilarity()) {
            return new FalsePositivePrediction(avgTp, false);
        }
        return FalsePositivePrediction.neutral();
    }

    public void learnFromFeedback(FeatureVector features, boolean falsePositive) {
        store.append(PatternLabel.of(falsePositive), features, config.getCapacity());

        PatternStatistics stats = statistics();
        metricsConfig.updatePatternMemorySize(stats.falsePositivePatterns(), stats.truePositivePatterns());
        log.info("Updated patterns: FP={}, TP={}", stats.falsePositivePatterns(), stats.truePositivePatterns());
    }

    public PatternStatistics statistics() {
        return new PatternStatistics(
                store.size(PatternLabel.FALSE_POSITIVE),
                store.size(PatternLabel.TRUE_POSITIVE),
                config.getCapacity());
    }

    /**
     * Cosine similarity clamped to [0, 1]. Zero when either vector has zero norm.
     */
    public static double cosineSimilarity(FeatureVector a, FeatureVector b) {
        double normA = a.norm();
        double normB = b.norm();
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double similarity = a.dot(b) / (normA * normB);
        return Math.max(0.0, Math.min(1.0, similarity));
    }

    private static double meanSimilarity(FeatureVector features, List<FeatureVector> patterns) {
        if (patterns.isEmpty()) return 0.0;
        double sum = 0.0;
        for (FeatureVector pattern : patterns) {
            sum += cosineSimilarity(features, pattern);
        }
        return sum / patterns.size();
    }
}
