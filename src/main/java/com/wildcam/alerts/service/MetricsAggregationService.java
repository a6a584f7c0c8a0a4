package com.wildcam.alerts.service;

import com.wildcam.alerts.exception.PersistenceBatchException;
import com.wildcam.alerts.model.Alert;
import com.wildcam.alerts.model.AlertMetrics;
import com.wildcam.alerts.model.Camera;
import com.wildcam.alerts.repository.AlertMetricsRepository;
import com.wildcam.alerts.repository.AlertRepository;
import com.wildcam.alerts.repository.CameraRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Daily per-camera alert metrics: creation counters, plus pattern-matching
 * accuracy and false-positive rate recomputed from user feedback.
 */
@Service
public class MetricsAggregationService {

    private static final Logger log = LoggerFactory.getLogger(MetricsAggregationService.class);

    static final String UNASSIGNED_CAMERA = "unassigned";

    private final AlertRepository alertRepository;
    private final AlertMetricsRepository metricsRepository;
    private final CameraRepository cameraRepository;
    private final Clock clock;

    public MetricsAggregationService(AlertRepository alertRepository,
                                     AlertMetricsRepository metricsRepository,
                                     CameraRepository cameraRepository,
                                     Clock clock) {
        this.alertRepository = alertRepository;
        this.metricsRepository = metricsRepository;
        this.cameraRepository = cameraRepository;
        this.clock = clock;
    }

    public void recordAlertCreated(Alert alert) {
        String cameraId = alert.getCameraId() != null ? alert.getCameraId() : UNASSIGNED_CAMERA;
        metricsRepository.incrementCounters(cameraId, today().toString(),
                alert.isFiltered(), alert.getFalsePositiveScore() > 0.5);
    }

    @Scheduled(cron = "${alerts.metrics.cron:0 55 23 * * *}", zone = "UTC")
    public void scheduledUpdate() {
        try {
            int updated = updateDailyMetrics();
            log.info("Daily metrics job complete: {} cameras updated", updated);
        } catch (PersistenceBatchException e) {
            log.error("Daily metrics job rolled back after {} writes: {}",
                    e.getCompletedBeforeFailure(), e.getMessage(), e);
        }
    }

    /**
     * Recompute today's accuracy and false-positive rate for every active camera.
     * All-or-nothing: on any failure, the accuracy values written in this run are
     * restored. Creation counters are left to their atomic increments.
     *
     * @return number of cameras updated
     * @throws PersistenceBatchException if a read or write fails
     */
    public int updateDailyMetrics() {
        LocalDate today = today();
        String date = today.toString();
        long dayStart = today.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        long dayEnd = today.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();

        // Previous accuracy values of every record touched so far, most recent on top
        Deque<AlertMetrics> undoLog = new ArrayDeque<>();
        try {
            for (Camera camera : cameraRepository.findActive()) {
                String cameraId = camera.getCameraId();
                List<Alert> withFeedback = alertRepository.findWithFeedback(cameraId, dayStart, dayEnd);
                Accuracy accuracy = calculateAccuracy(withFeedback);

                AlertMetrics previous = metricsRepository.find(cameraId, date);
                AlertMetrics updated = AlertMetrics.builder()
                        .cameraId(cameraId)
                        .date(date)
                        .mlAccuracy(accuracy.accuracy())
                        .falsePositiveRate(accuracy.falsePositiveRate())
                        .feedbackCount(accuracy.total())
                        .build();

                undoLog.push(previous != null
                        ? previous
                        : AlertMetrics.builder().cameraId(cameraId).date(date).build());
                metricsRepository.saveAccuracy(updated);
            }
        } catch (Exception e) {
            int completed = undoLog.size();
            rollback(undoLog, e);
            throw new PersistenceBatchException("Daily metrics update failed for " + date, completed, e);
        }
        return undoLog.size();
    }

    static Accuracy calculateAccuracy(List<Alert> alertsWithFeedback) {
        int total = alertsWithFeedback.size();
        if (total == 0) {
            return new Accuracy(0.0, 0.0, 0);
        }
        int correct = 0;
        int falsePositives = 0;
        for (Alert alert : alertsWithFeedback) {
            boolean predictedFp = alert.getFalsePositiveScore() > 0.5;
            boolean confirmedFp = Boolean.TRUE.equals(alert.getUserFalsePositive());
            if (predictedFp == confirmedFp) correct++;
            if (confirmedFp) falsePositives++;
        }
        return new Accuracy((double) correct / total, (double) falsePositives / total, total);
    }

    private void rollback(Deque<AlertMetrics> undoLog, Exception cause) {
        while (!undoLog.isEmpty()) {
            AlertMetrics previous = undoLog.pop();
            try {
                metricsRepository.saveAccuracy(previous);
            } catch (Exception e) {
                cause.addSuppressed(e);
                log.error("Failed to restore metrics for camera={} date={}: {}",
                        previous.getCameraId(), previous.getDate(), e.getMessage());
            }
        }
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC));
    }

    record Accuracy(double accuracy, double falsePositiveRate, long total) {
    }
}
