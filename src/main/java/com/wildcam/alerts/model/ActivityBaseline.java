package com.wildcam.alerts.model;

import java.util.List;

/**
 * Point-in-time copy of a species' retained detection history.
 *
 * @param timestamps  retained detection times (epoch ms), oldest first
 * @param hourCounts  24-bucket UTC hour-of-day histogram over the same points
 * @param firstSeen   earliest detection ever recorded for the species, 0 if none
 */
public record ActivityBaseline(String species, List<Long> timestamps, int[] hourCounts, long firstSeen) {

    public int size() {
        return timestamps.size();
    }

    public static ActivityBaseline empty(String species) {
        return new ActivityBaseline(species, List.of(), new int[24], 0L);
    }
}
