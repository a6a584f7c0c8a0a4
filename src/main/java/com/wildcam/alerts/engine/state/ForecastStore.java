package com.wildcam.alerts.engine.state;

import java.util.List;
import java.util.Set;

/**
 * Per-species, per-hour-of-day observed counts backing the forecaster.
 */
public interface ForecastStore {

    /**
     * Append an observed count for the species at the given UTC hour, keeping at
     * most {@code capacity} samples for that hour. Returns false without storing
     * anything when {@code timestampMillis} is older than the species' latest sample.
     */
    boolean append(String species, int hour, long timestampMillis, double count, int capacity);

    List<Double> samples(String species, int hour);

    Set<String> species();
}
