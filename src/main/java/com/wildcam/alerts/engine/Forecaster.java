package com.wildcam.alerts.engine;

import com.wildcam.alerts.config.AlertEngineProperties;
import com.wildcam.alerts.engine.state.ForecastStore;
import com.wildcam.alerts.model.ActivityForecast;
import com.wildcam.alerts.model.UnexpectedActivity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Expected detection counts per species and hour of day, with a
 * mean +/- k-sigma interval (k = 2 by default, lower bound floored at 0).
 */
@Component
public class Forecaster {

    private static final Logger log = LoggerFactory.getLogger(Forecaster.class);

    private final ForecastStore store;
    private final AlertEngineProperties.Forecast config;

    public Forecaster(ForecastStore store, AlertEngineProperties properties) {
        this.store = store;
        this.config = properties.getForecast();
    }

    public boolean learnPattern(String species, Instant timestamp, double count) {
        int hour = hourOf(timestamp);
        boolean stored = store.append(species, hour, timestamp.toEpochMilli(), count, config.getCapacity());
        if (!stored) {
            log.warn("Rejected out-of-order forecast sample for species={} at {}", species, timestamp);
        }
        return stored;
    }

    public ActivityForecast forecastActivity(String species, Instant timestamp) {
        int hour = hourOf(timestamp);
        List<Double> samples = store.samples(species, hour);
        if (samples.size() < config.getMinSamples()) {
            return ActivityForecast.none(species, hour, samples.size());
        }

        double mean = samples.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = samples.stream()
                .mapToDouble(c -> (c - mean) * (c - mean))
                .sum() / samples.size();
        double std = Math.sqrt(variance);
        double margin = config.getIntervalSigmas() * std;

        return ActivityForecast.builder()
                .species(species)
                .hour(hour)
                .hasForecast(true)
                .expectedCount(mean)
                .stdDev(std)
                .lowerBound(Math.max(0.0, mean - margin))
                .upperBound(mean + margin)
                .sampleCount(samples.size())
                .build();
    }

    public UnexpectedActivity isUnexpectedActivity(String species, Instant timestamp, double actualCount) {
        ActivityForecast forecast = forecastActivity(species, timestamp);
        if (!forecast.isHasForecast()) {
            return new UnexpectedActivity(false, 0.0, forecast);
        }

        double distance;
        if (actualCount < forecast.getLowerBound()) {
            distance = forecast.getLowerBound() - actualCount;
        } else if (actualCount > forecast.getUpperBound()) {
            distance = actualCount - forecast.getUpperBound();
        } else {
            return new UnexpectedActivity(false, 0.0, forecast);
        }
        double deviation = distance / Math.max(forecast.getExpectedCount(), 1.0);
        return new UnexpectedActivity(true, deviation, forecast);
    }

    private static int hourOf(Instant timestamp) {
        return timestamp.atZone(ZoneOffset.UTC).getHour();
    }
}
