package com.wildcam.alerts.engine;

import com.wildcam.alerts.config.AlertEngineProperties;
import com.wildcam.alerts.engine.state.InMemoryForecastStore;
import com.wildcam.alerts.model.ActivityForecast;
import com.wildcam.alerts.model.UnexpectedActivity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ForecasterTest {

    private static final String SPECIES = "moose";

    private InMemoryForecastStore store;
    private Forecaster forecaster;

    @BeforeEach
    void setUp() {
        store = new InMemoryForecastStore();
        forecaster = new Forecaster(store, new AlertEngineProperties());
    }

    @Test
    void forecast_fewerThanThreeSamples_noForecast() {
        forecaster.learnPattern(SPECIES, Instant.parse("2024-06-01T06:00:00Z"), 4);
        forecaster.learnPattern(SPECIES, Instant.parse("2024-06-02T06:00:00Z"), 6);

        ActivityForecast forecast = forecaster.forecastActivity(SPECIES, Instant.parse("2024-06-03T06:20:00Z"));

        assertThat(forecast.isHasForecast()).isFalse();
        assertThat(forecast.getSampleCount()).isEqualTo(2);
        assertThat(forecast.getHour()).isEqualTo(6);
    }

    @Test
    void forecast_threeSamples_meanWithTwoSigmaInterval() {
        learnThreeDawns();

        ActivityForecast forecast = forecaster.forecastActivity(SPECIES, Instant.parse("2024-06-04T06:45:00Z"));

        double std = Math.sqrt(8.0 / 3.0);
        assertThat(forecast.isHasForecast()).isTrue();
        assertThat(forecast.getExpectedCount()).isCloseTo(6.0, within(1e-9));
        assertThat(forecast.getStdDev()).isCloseTo(std, within(1e-9));
        assertThat(forecast.getLowerBound()).isCloseTo(6.0 - 2 * std, within(1e-9));
        assertThat(forecast.getUpperBound()).isCloseTo(6.0 + 2 * std, within(1e-9));
    }

    @Test
    void forecast_otherHour_usesOwnBucket() {
        learnThreeDawns();

        ActivityForecast forecast = forecaster.forecastActivity(SPECIES, Instant.parse("2024-06-04T07:00:00Z"));

        assertThat(forecast.isHasForecast()).isFalse();
    }

    @Test
    void forecast_widelySpreadSamples_lowerBoundFlooredAtZero() {
        forecaster.learnPattern(SPECIES, Instant.parse("2024-06-01T22:00:00Z"), 0);
        forecaster.learnPattern(SPECIES, Instant.parse("2024-06-02T22:00:00Z"), 0);
        forecaster.learnPattern(SPECIES, Instant.parse("2024-06-03T22:00:00Z"), 9);

        ActivityForecast forecast = forecaster.forecastActivity(SPECIES, Instant.parse("2024-06-04T22:00:00Z"));

        assertThat(forecast.getLowerBound()).isZero();
    }

    @Test
    void unexpected_aboveUpperBound_deviationRelativeToExpected() {
        learnThreeDawns();
        double upper = 6.0 + 2 * Math.sqrt(8.0 / 3.0);

        UnexpectedActivity result = forecaster.isUnexpectedActivity(SPECIES, Instant.parse("2024-06-04T06:00:00Z"), 12);

        assertThat(result.unexpected()).isTrue();
        assertThat(result.deviation()).isCloseTo((12 - upper) / 6.0, within(1e-9));
    }

    @Test
    void unexpected_withinInterval_notUnexpected() {
        learnThreeDawns();

        UnexpectedActivity result = forecaster.isUnexpectedActivity(SPECIES, Instant.parse("2024-06-04T06:00:00Z"), 7);

        assertThat(result.unexpected()).isFalse();
        assertThat(result.deviation()).isZero();
    }

    @Test
    void unexpected_noForecast_notUnexpected() {
        UnexpectedActivity result = forecaster.isUnexpectedActivity(SPECIES, Instant.parse("2024-06-04T06:00:00Z"), 50);

        assertThat(result.unexpected()).isFalse();
        assertThat(result.forecast().isHasForecast()).isFalse();
    }

    @Test
    void learn_outOfOrderSample_rejected() {
        assertThat(forecaster.learnPattern(SPECIES, Instant.parse("2024-06-03T06:00:00Z"), 5)).isTrue();

        boolean stored = forecaster.learnPattern(SPECIES, Instant.parse("2024-06-01T06:00:00Z"), 5);

        assertThat(stored).isFalse();
    }

    @Test
    void learn_beyondCapacity_oldestSamplesEvicted() {
        Instant firstDawn = Instant.parse("2024-01-01T06:00:00Z");
        for (int day = 0; day <= 100; day++) {
            forecaster.learnPattern(SPECIES, firstDawn.plus(Duration.ofDays(day)), day);
        }

        assertThat(store.samples(SPECIES, 6)).hasSize(100);
        assertThat(store.samples(SPECIES, 6).get(0)).isEqualTo(1.0);
        assertThat(store.samples(SPECIES, 6).get(99)).isEqualTo(100.0);

        ActivityForecast forecast = forecaster.forecastActivity(SPECIES, Instant.parse("2024-04-15T06:30:00Z"));
        assertThat(forecast.getSampleCount()).isEqualTo(100);
        assertThat(forecast.getExpectedCount()).isCloseTo(50.5, within(1e-9));
    }

    private void learnThreeDawns() {
        forecaster.learnPattern(SPECIES, Instant.parse("2024-06-01T06:00:00Z"), 4);
        forecaster.learnPattern(SPECIES, Instant.parse("2024-06-02T06:00:00Z"), 6);
        forecaster.learnPattern(SPECIES, Instant.parse("2024-06-03T06:00:00Z"), 8);
    }
}
