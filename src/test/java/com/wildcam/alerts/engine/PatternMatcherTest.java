package com.wildcam.alerts.engine;

import com.wildcam.alerts.config.AlertEngineProperties;
import com.wildcam.alerts.config.MetricsConfig;
import com.wildcam.alerts.engine.state.InMemoryPatternStore;
import com.wildcam.alerts.model.FalsePositivePrediction;
import com.wildcam.alerts.model.FeatureVector;
import com.wildcam.alerts.model.PatternLabel;
import com.wildcam.alerts.model.PatternStatistics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PatternMatcherTest {

    private static final FeatureVector NIGHT_NOISE = FeatureVector.of(0.3, 0.1, 0, 0.2, 0.9, 0.8, 0.9, 0.1, 0);
    private static final FeatureVector DAWN_BEAR = FeatureVector.of(0.95, 0.25, 1, 0.4, 0.5, 0, 0.2, 0.3, 1);

    @Mock private MetricsConfig metricsConfig;

    private InMemoryPatternStore store;
    private PatternMatcher matcher;

    @BeforeEach
    void setUp() {
        store = new InMemoryPatternStore();
        matcher = new PatternMatcher(store, new AlertEngineProperties(), metricsConfig);
    }

    @Test
    void predict_noLearnedPatterns_returnsNeutral() {
        FalsePositivePrediction prediction = matcher.predictFalsePositive(DAWN_BEAR);

        assertThat(prediction.confidence()).isEqualTo(0.5);
        assertThat(prediction.falsePositive()).isFalse();
    }

    @Test
    void predict_resemblesFalsePositives_flaggedWithInvertedConfidence() {
        matcher.learnFromFeedback(NIGHT_NOISE, true);

        FalsePositivePrediction prediction = matcher.predictFalsePositive(NIGHT_NOISE);

        assertThat(prediction.falsePositive()).isTrue();
        assertThat(prediction.confidence()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void predict_resemblesTruePositives_genuineWithSimilarityAsConfidence() {
        matcher.learnFromFeedback(DAWN_BEAR, false);

        FalsePositivePrediction prediction = matcher.predictFalsePositive(DAWN_BEAR);

        assertThat(prediction.falsePositive()).isFalse();
        assertThat(prediction.confidence()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void predict_weakSimilarityToBoth_fallsBackToNeutral() {
        FeatureVector onlyFirst = FeatureVector.of(1, 0, 0, 0, 0, 0, 0, 0, 0);
        FeatureVector onlyLast = FeatureVector.of(0, 0, 0, 0, 0, 0, 0, 0, 1);
        matcher.learnFromFeedback(onlyLast, true);
        matcher.learnFromFeedback(onlyLast, false);

        FalsePositivePrediction prediction = matcher.predictFalsePositive(onlyFirst);

        assertThat(prediction.confidence()).isEqualTo(0.5);
        assertThat(prediction.falsePositive()).isFalse();
    }

    @Test
    void learn_beyondCapacity_evictsOldestAndKeepsMostRecent() {
        for (int i = 0; i < 205; i++) {
            matcher.learnFromFeedback(FeatureVector.of(i, 0, 0, 0, 0, 0, 0, 0, 1), true);
        }

        PatternStatistics stats = matcher.statistics();
        assertThat(stats.falsePositivePatterns()).isEqualTo(200);
        assertThat(stats.truePositivePatterns()).isZero();
        assertThat(stats.capacity()).isEqualTo(200);

        List<FeatureVector> all = store.recent(PatternLabel.FALSE_POSITIVE, 200);
        assertThat(all.get(0).get(0)).isEqualTo(5.0);
        assertThat(all.get(199).get(0)).isEqualTo(204.0);
    }

    @Test
    void learn_updatesPatternGauge() {
        matcher.learnFromFeedback(DAWN_BEAR, false);

        verify(metricsConfig).updatePatternMemorySize(0, 1);
    }

    @Test
    void cosineSimilarity_identicalVectors_one() {
        assertThat(PatternMatcher.cosineSimilarity(DAWN_BEAR, DAWN_BEAR)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void cosineSimilarity_zeroVector_zero() {
        FeatureVector zero = FeatureVector.of(0, 0, 0, 0, 0, 0, 0, 0, 0);

        assertThat(PatternMatcher.cosineSimilarity(zero, DAWN_BEAR)).isZero();
    }

    @Test
    void cosineSimilarity_opposedVectors_clampedToZero() {
        FeatureVector positive = FeatureVector.of(1, 1, 0, 0, 0, 0, 0, 0, 0);
        FeatureVector negative = FeatureVector.of(-1, -1, 0, 0, 0, 0, 0, 0, 0);

        assertThat(PatternMatcher.cosineSimilarity(positive, negative)).isZero();
    }
}
