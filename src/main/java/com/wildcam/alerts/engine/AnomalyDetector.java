package com.wildcam.alerts.engine;

import com.wildcam.alerts.config.AlertEngineProperties;
import com.wildcam.alerts.engine.state.ActivityStore;
import com.wildcam.alerts.model.ActivityBaseline;
import com.wildcam.alerts.model.AnomalyResult;
import com.wildcam.alerts.model.AnomalyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-species activity anomaly detection over fixed-length windows.
 *
 * The current window is [now - W, now]. Baseline window i (1..N) is
 * [now - (i+1)W, now - iW). A baseline window only counts once the species
 * was already being observed before it ended. The z-score of the current count
 * against the baseline counts decides high/low activity; a separate hour-of-day
 * check flags detections at hours where the species is rarely seen.
 */
@Component
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    private final ActivityStore store;
    private final AlertEngineProperties.Anomaly config;

    public AnomalyDetector(ActivityStore store, AlertEngineProperties properties) {
        this.store = store;
        this.config = properties.getAnomaly();
    }

    /**
     * Record a detection into the species' history.
     *
     * @return true if recorded; false when ignored for low confidence or rejected as out of order
     */
    public boolean recordDetection(String species, Instant timestamp, double confidence) {
        if (confidence < config.getMinConfidence()) {
            return false;
        }
        long ts = timestamp.toEpochMilli();
        if (!store.append(species, ts)) {
            log.warn("Rejected out-of-order detection for species={} at {}", species, timestamp);
            return false;
        }
        store.evictBefore(species, ts - retentionMillis());
        return true;
    }

    public AnomalyResult detectAnomaly(String species, Instant now) {
        ActivityBaseline baseline = store.snapshot(species);
        int points = baseline.size();
        if (points < config.getMinPoints()) {
            return AnomalyResult.insufficient(species, AnomalyType.INSUFFICIENT_DATA, points);
        }

        long nowMs = now.toEpochMilli();
        long window = windowMillis();
        List<Long> timestamps = baseline.timestamps();

        long currentCount = countBetween(timestamps, nowMs - window, nowMs, true);

        List<Long> baselineCounts = new ArrayList<>();
        for (int i = 1; i <= config.getBaselineWindows(); i++) {
            long end = nowMs - i * window;
            long start = end - window;
            if (end <= baseline.firstSeen()) {
                break;
            }
            baselineCounts.add(countBetween(timestamps, start, end, false));
        }
        if (baselineCounts.size() < config.getMinBaselineWindows()) {
            return AnomalyResult.builder()
                    .species(species)
                    .anomaly(false)
                    .anomalyType(AnomalyType.INSUFFICIENT_BASELINE)
                    .currentCount(currentCount)
                    .baselineWindows(baselineCounts.size())
                    .historyPoints(points)
                    .build();
        }

        double mean = baselineCounts.stream().mapToLong(Long::longValue).average().orElse(0.0);
        double variance = baselineCounts.stream()
                .mapToDouble(c -> (c - mean) * (c - mean))
                .sum() / baselineCounts.size();
        double std = Math.max(Math.sqrt(variance), config.getMinStdDev());
        double z = (currentCount - mean) / std;

        boolean anomaly = Math.abs(z) > config.getZThreshold();
        AnomalyType type = anomaly
                ? (z > 0 ? AnomalyType.UNUSUAL_HIGH_ACTIVITY : AnomalyType.UNUSUAL_LOW_ACTIVITY)
                : AnomalyType.NORMAL;

        if (points >= config.getTimingMinPoints()) {
            int hour = now.atZone(ZoneOffset.UTC).getHour();
            double avgPerHour = points / 24.0;
            if (baseline.hourCounts()[hour] < config.getTimingRatio() * avgPerHour) {
                anomaly = true;
                type = AnomalyType.UNUSUAL_TIMING;
            }
        }

        if (anomaly) {
            log.info("Activity anomaly for species={}: type={}, z={}, current={}, baselineMean={}",
                    species, type, String.format("%.2f", z), currentCount, String.format("%.2f", mean));
        }

        return AnomalyResult.builder()
                .species(species)
                .anomaly(anomaly)
                .anomalyType(type)
                .zScore(z)
                .anomalyScore(Math.abs(z))
                .baselineMean(mean)
                .currentCount(currentCount)
                .baselineWindows(baselineCounts.size())
                .historyPoints(points)
                .build();
    }

    private long windowMillis() {
        return config.getWindowHours() * 3_600_000L;
    }

    // Current window plus every baseline window
    private long retentionMillis() {
        return (config.getBaselineWindows() + 1) * windowMillis();
    }

    private static long countBetween(List<Long> timestamps, long start, long end, boolean endInclusive) {
        long count = 0;
        for (long ts : timestamps) {
            if (ts >= start && (endInclusive ? ts <= end : ts < end)) {
                count++;
            }
        }
        return count;
    }
}
