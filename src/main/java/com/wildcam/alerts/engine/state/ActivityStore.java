package com.wildcam.alerts.engine.state;

import com.wildcam.alerts.model.ActivityBaseline;

import java.util.Set;

/**
 * Per-species detection history backing the activity anomaly detector.
 */
public interface ActivityStore {

    /**
     * Record a detection time. Returns false, leaving the history untouched, when
     * the timestamp is older than the latest one already recorded for the species.
     */
    boolean append(String species, long timestampMillis);

    /**
     * Drop points strictly older than {@code cutoffMillis}. First-seen is kept.
     */
    void evictBefore(String species, long cutoffMillis);

    ActivityBaseline snapshot(String species);

    Set<String> species();
}
