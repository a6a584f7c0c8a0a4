package com.wildcam.alerts.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wildcam.alerts.config.AlertEngineProperties;
import com.wildcam.alerts.config.MetricsConfig;
import com.wildcam.alerts.engine.AlertEvaluationEngine;
import com.wildcam.alerts.engine.AnomalyDetector;
import com.wildcam.alerts.engine.FeatureExtractor;
import com.wildcam.alerts.engine.Forecaster;
import com.wildcam.alerts.engine.PatternMatcher;
import com.wildcam.alerts.engine.PriorityAssigner;
import com.wildcam.alerts.engine.state.InMemoryActivityStore;
import com.wildcam.alerts.engine.state.InMemoryForecastStore;
import com.wildcam.alerts.engine.state.InMemoryPatternStore;
import com.wildcam.alerts.exception.AlertNotFoundException;
import com.wildcam.alerts.exception.InvalidDetectionException;
import com.wildcam.alerts.model.*;
import com.wildcam.alerts.repository.AlertRepository;
import com.wildcam.alerts.repository.DeliveryRecordRepository;
import com.wildcam.alerts.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertServiceTest {

    @Mock private AlertRepository alertRepository;
    @Mock private DeliveryRecordRepository deliveryRecordRepository;
    @Mock private MetricsAggregationService metricsAggregationService;
    @Mock private MetricsConfig metricsConfig;

    private final Clock clock = TestDataFactory.fixedClock("2024-06-03T10:00:00Z");

    private PatternMatcher patternMatcher;
    private InMemoryActivityStore activityStore;
    private AlertService alertService;

    @BeforeEach
    void setUp() {
        AlertEngineProperties properties = new AlertEngineProperties();
        patternMatcher = new PatternMatcher(new InMemoryPatternStore(), properties, metricsConfig);
        activityStore = new InMemoryActivityStore();

        alertService = new AlertService(
                new AlertEvaluationEngine(patternMatcher, new PriorityAssigner(), properties, metricsConfig),
                patternMatcher,
                new AnomalyDetector(activityStore, properties),
                new Forecaster(new InMemoryForecastStore(), properties),
                alertRepository, deliveryRecordRepository, metricsAggregationService, properties, metricsConfig,
                new ObjectMapper(), clock);
    }

    @Test
    void createAlert_dawnBear_persistedEmergencyAlert() {
        DetectionEvent detection = TestDataFactory.createDetection("DET-1", "grizzly_bear", 0.92, "2024-06-03T06:15:00Z");

        Alert alert = alertService.createAlert(detection);

        assertThat(alert.getAlertId()).isEqualTo("ALT-DET-1");
        assertThat(alert.getSeverity()).isEqualTo(Severity.EMERGENCY);
        assertThat(alert.getPriority()).isEqualTo("high");
        assertThat(alert.getTitle()).startsWith("EMERGENCY: grizzly_bear detected with");
        assertThat(alert.getMessage()).contains("North Ridge", "IMMEDIATE ACTION");
        assertThat(alert.getRecommendation()).isEqualTo(Recommendation.IMMEDIATE_ACTION);
        assertThat(alert.isFiltered()).isFalse();
        assertThat(alert.getCreatedAt()).isEqualTo(clock.millis());
        assertThat(alert.getData()).containsEntry("species", "grizzly_bear").containsKey("anomalyInfo");
        assertThat(alert.getData()).doesNotContainKey("forecast");

        verify(alertRepository).save(alert);
        verify(metricsAggregationService).recordAlertCreated(alert);
        assertThat(activityStore.snapshot("grizzly_bear").size()).isEqualTo(1);
    }

    @Test
    void createAlert_poorVisibility_filteredWithQueueReason() {
        DetectionEvent detection = TestDataFactory.createDetectionInWeather(
                "deer", 0.7, "2024-06-03T12:00:00Z", 15.0, 5.0, 3.0);

        Alert alert = alertService.createAlert(detection);

        assertThat(alert.isFiltered()).isTrue();
        assertThat(alert.getFilterReason()).startsWith("QUEUE");
        verify(metricsConfig).recordFiltered("QUEUE");
        verify(alertRepository).save(alert);
    }

    @Test
    void createAlert_learnedFalsePositive_filtered() {
        DetectionEvent detection = TestDataFactory.createDetection("DET-FP", "raccoon", 0.6, "2024-06-03T02:00:00Z");
        patternMatcher.learnFromFeedback(FeatureExtractor.extract(detection), true);

        Alert alert = alertService.createAlert(detection);

        assertThat(alert.getFalsePositiveScore()).isEqualTo(1.0);
        assertThat(alert.isFiltered()).isTrue();
        assertThat(alert.getFilterReason()).startsWith("REVIEW");
    }

    @Test
    void createAlert_invalidTimestamp_nothingPersisted() {
        DetectionEvent detection = TestDataFactory.createDetection("DET-2", "elk", 0.7, "soon");

        assertThatThrownBy(() -> alertService.createAlert(detection))
                .isInstanceOf(InvalidDetectionException.class);
        verify(alertRepository, never()).save(any());
        assertThat(activityStore.species()).isEmpty();
    }

    @Test
    void createAlert_dailyCounterFailure_alertStillReturned() {
        doThrow(new RuntimeException("aerospike down")).when(metricsAggregationService).recordAlertCreated(any());
        DetectionEvent detection = TestDataFactory.createDetection("DET-3", "gray_wolf", 0.8, "2024-06-03T18:00:00Z");

        Alert alert = alertService.createAlert(detection);

        assertThat(alert.getSeverity()).isEqualTo(Severity.CRITICAL);
        verify(alertRepository).save(alert);
    }

    @Test
    void createAlert_noDetectionId_generatedAlertId() {
        DetectionEvent detection = TestDataFactory.createDetection(null, "elk", 0.7, "2024-06-03T12:00:00Z");

        Alert alert = alertService.createAlert(detection);

        assertThat(alert.getAlertId()).startsWith("ALT-").hasSizeGreaterThan(30);
    }

    @Test
    void shouldFilterAlert_lowConfidenceInfo_filtered() {
        Alert alert = TestDataFactory.createAlert("ALT-I", Severity.INFO, false);
        alert.setMlConfidence(0.3);
        AlertEvaluation evaluation = AlertEvaluation.builder()
                .priority(Severity.INFO).mlConfidence(0.3).recommendation(Recommendation.NOTIFY).build();

        assertThat(alertService.shouldFilterAlert(alert, evaluation)).isTrue();
    }

    @Test
    void shouldFilterAlert_falsePositiveBelowScoreThreshold_kept() {
        Alert alert = TestDataFactory.createAlert("ALT-F", Severity.WARNING, false);
        alert.setFalsePositiveScore(0.5);
        AlertEvaluation evaluation = AlertEvaluation.builder()
                .priority(Severity.WARNING).falsePositive(true).mlConfidence(0.2)
                .recommendation(Recommendation.REVIEW).build();

        assertThat(alertService.shouldFilterAlert(alert, evaluation)).isFalse();
    }

    @Test
    void processFeedback_learnsFromStoredDetection() {
        DetectionEvent detection = TestDataFactory.createDetection("DET-4", "coyote", 0.55, "2024-06-03T03:00:00Z");
        Alert alert = alertService.createAlert(detection);
        when(alertRepository.findById("ALT-DET-4")).thenReturn(alert);

        Alert updated = alertService.processFeedback("ALT-DET-4", true);

        assertThat(updated.getUserFalsePositive()).isTrue();
        assertThat(patternMatcher.statistics().falsePositivePatterns()).isEqualTo(1);
        verify(alertRepository, times(2)).save(alert);
    }

    @Test
    void processFeedback_unusableDetectionContext_feedbackStillStored() {
        Alert alert = TestDataFactory.createAlert("ALT-5", Severity.WARNING, false);
        alert.setData(Map.of("note", "imported without detection"));
        when(alertRepository.findById("ALT-5")).thenReturn(alert);

        Alert updated = alertService.processFeedback("ALT-5", false);

        assertThat(updated.getUserFalsePositive()).isFalse();
        assertThat(patternMatcher.statistics().totalPatterns()).isZero();
        verify(alertRepository).save(alert);
    }

    @Test
    void getAlert_unknownId_notFound() {
        when(alertRepository.findById("ALT-404")).thenReturn(null);

        assertThatThrownBy(() -> alertService.getAlert("ALT-404"))
                .isInstanceOf(AlertNotFoundException.class)
                .hasMessageContaining("ALT-404");
    }

    @Test
    void acknowledge_twice_savedOnce() {
        Alert alert = TestDataFactory.createAlert("ALT-6", Severity.CRITICAL, false);
        when(alertRepository.findById("ALT-6")).thenReturn(alert);

        alertService.acknowledge("ALT-6");
        alertService.acknowledge("ALT-6");

        assertThat(alert.isAcknowledged()).isTrue();
        assertThat(alert.getAcknowledgedAt()).isEqualTo(clock.millis());
        verify(alertRepository, times(1)).save(alert);
    }

    @Test
    void resolve_setsResolvedAt() {
        Alert alert = TestDataFactory.createAlert("ALT-7", Severity.WARNING, false);
        when(alertRepository.findById("ALT-7")).thenReturn(alert);

        Alert resolved = alertService.resolve("ALT-7");

        assertThat(resolved.isResolved()).isTrue();
        assertThat(resolved.getResolvedAt()).isEqualTo(clock.millis());
    }

    @Test
    void getDeliveries_existingAlert_returnsRecords() {
        when(alertRepository.findById("ALT-8")).thenReturn(TestDataFactory.createAlert("ALT-8", Severity.CRITICAL, false));
        DeliveryRecord record = DeliveryRecord.builder()
                .alertId("ALT-8").channel(DeliveryChannel.WEBHOOK).target("https://hooks.example.org/a")
                .status(DeliveryStatus.FAILED).attempts(3).lastError("HTTP 500").completedAt(clock.millis())
                .build();
        when(deliveryRecordRepository.findByAlertId("ALT-8")).thenReturn(List.of(record));

        assertThat(alertService.getDeliveries("ALT-8")).containsExactly(record);
    }

    @Test
    void getDeliveries_unknownAlert_notFoundWithoutScan() {
        when(alertRepository.findById("ALT-404")).thenReturn(null);

        assertThatThrownBy(() -> alertService.getDeliveries("ALT-404"))
                .isInstanceOf(AlertNotFoundException.class);
        verifyNoInteractions(deliveryRecordRepository);
    }

    @Test
    void createAlert_replayedDetection_storedAlertReturnedUnchanged() {
        DetectionEvent detection = TestDataFactory.createDetection("DET-9", "black_bear", 0.9, "2024-06-03T07:00:00Z");
        Alert created = alertService.createAlert(detection);
        when(alertRepository.findById("ALT-DET-9")).thenReturn(created);
        alertService.resolve("ALT-DET-9");
        alertService.processFeedback("ALT-DET-9", false);

        Alert replayed = alertService.createAlert(detection);

        assertThat(replayed).isSameAs(created);
        assertThat(replayed.isResolved()).isTrue();
        assertThat(replayed.getResolvedAt()).isEqualTo(clock.millis());
        assertThat(replayed.getUserFalsePositive()).isFalse();
        assertThat(activityStore.snapshot("black_bear").size()).isEqualTo(1);
        verify(metricsAggregationService, times(1)).recordAlertCreated(any());
        // create, resolve and feedback; nothing from the replay
        verify(alertRepository, times(3)).save(created);
    }

    @Test
    void createAlert_firstOfItsKind_opensCorrelationGroup() {
        DetectionEvent detection = TestDataFactory.createDetection("DET-10", "grizzly_bear", 0.9, "2024-06-03T09:58:00Z");

        Alert alert = alertService.createAlert(detection);

        assertThat(alert.getCorrelationGroup()).isEqualTo("CG_CAM-1_20240603100000");
        assertThat(alert.getDuplicateOf()).isNull();
        verify(alertRepository).findRecent("CAM-1", "grizzly_bear", clock.millis() - 10 * 60_000L);
    }

    @Test
    void createAlert_recentSameSpecies_joinsGroupAndMarksDuplicate() {
        long now = clock.millis();
        Alert repeat = recentAlert("ALT-R1", now - 2 * 60_000L, "CG_CAM-1_20240603095200", "ALT-R2");
        Alert original = recentAlert("ALT-R2", now - 4 * 60_000L, "CG_CAM-1_20240603095200", null);
        Alert older = recentAlert("ALT-R3", now - 8 * 60_000L, "CG_CAM-1_20240603095200", null);
        when(alertRepository.findRecent(eq("CAM-1"), eq("grizzly_bear"), anyLong()))
                .thenReturn(List.of(repeat, original, older));
        DetectionEvent detection = TestDataFactory.createDetection("DET-11", "grizzly_bear", 0.9, "2024-06-03T09:59:00Z");

        Alert alert = alertService.createAlert(detection);

        assertThat(alert.getCorrelationGroup()).isEqualTo("CG_CAM-1_20240603095200");
        assertThat(alert.getDuplicateOf()).isEqualTo("ALT-R2");
    }

    @Test
    void createAlert_groupedButOutsideDuplicateWindow_notDuplicate() {
        Alert older = recentAlert("ALT-R3", clock.millis() - 8 * 60_000L, "CG_CAM-1_20240603095200", null);
        when(alertRepository.findRecent(eq("CAM-1"), eq("grizzly_bear"), anyLong())).thenReturn(List.of(older));
        DetectionEvent detection = TestDataFactory.createDetection("DET-12", "grizzly_bear", 0.9, "2024-06-03T09:59:00Z");

        Alert alert = alertService.createAlert(detection);

        assertThat(alert.getCorrelationGroup()).isEqualTo("CG_CAM-1_20240603095200");
        assertThat(alert.getDuplicateOf()).isNull();
    }

    private static Alert recentAlert(String alertId, long createdAt, String group, String duplicateOf) {
        Alert alert = TestDataFactory.createAlert(alertId, Severity.EMERGENCY, false);
        alert.setCreatedAt(createdAt);
        alert.setCorrelationGroup(group);
        alert.setDuplicateOf(duplicateOf);
        return alert;
    }
}
