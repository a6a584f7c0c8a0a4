package com.wildcam.alerts.service;

import com.wildcam.alerts.engine.AnomalyDetector;
import com.wildcam.alerts.engine.Forecaster;
import com.wildcam.alerts.engine.PatternMatcher;
import com.wildcam.alerts.engine.state.ActivityStore;
import com.wildcam.alerts.model.ActivityForecast;
import com.wildcam.alerts.model.AnomalyResult;
import com.wildcam.alerts.model.PatternStatistics;
import com.wildcam.alerts.model.UnexpectedActivity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Species activity queries, and the hourly job that feeds observed per-species
 * counts into the forecaster.
 */
@Service
public class ActivityForecastService {

    private static final Logger log = LoggerFactory.getLogger(ActivityForecastService.class);

    private final ActivityStore activityStore;
    private final AnomalyDetector anomalyDetector;
    private final Forecaster forecaster;
    private final PatternMatcher patternMatcher;
    private final Clock clock;

    public ActivityForecastService(ActivityStore activityStore, AnomalyDetector anomalyDetector,
                                   Forecaster forecaster, PatternMatcher patternMatcher, Clock clock) {
        this.activityStore = activityStore;
        this.anomalyDetector = anomalyDetector;
        this.forecaster = forecaster;
        this.patternMatcher = patternMatcher;
        this.clock = clock;
    }

    @Scheduled(cron = "${alerts.forecast.cron:0 0 * * * *}", zone = "UTC")
    public void scheduledLearn() {
        learnHourlyActivity();
    }

    /**
     * Learn the detection count of the hour that just ended for every known species.
     *
     * @return number of species learned
     */
    public int learnHourlyActivity() {
        Instant hourEnd = clock.instant().truncatedTo(ChronoUnit.HOURS);
        Instant hourStart = hourEnd.minus(Duration.ofHours(1));
        long from = hourStart.toEpochMilli();
        long to = hourEnd.toEpochMilli();

        int learned = 0;
        for (String species : activityStore.species()) {
            long count = activityStore.snapshot(species).timestamps().stream()
                    .filter(ts -> ts >= from && ts < to)
                    .count();
            if (forecaster.learnPattern(species, hourStart, count)) {
                learned++;
            }
        }
        log.info("Hourly activity learned for {} species (hour starting {})", learned, hourStart);
        return learned;
    }

    public AnomalyResult detectAnomaly(String species, Instant at) {
        return anomalyDetector.detectAnomaly(species, at != null ? at : clock.instant());
    }

    public ActivityForecast forecast(String species, Instant at) {
        return forecaster.forecastActivity(species, at != null ? at : clock.instant());
    }

    public UnexpectedActivity checkActivity(String species, Instant at, double actualCount) {
        return forecaster.isUnexpectedActivity(species, at != null ? at : clock.instant(), actualCount);
    }

    public PatternStatistics patternStatistics() {
        return patternMatcher.statistics();
    }
}
