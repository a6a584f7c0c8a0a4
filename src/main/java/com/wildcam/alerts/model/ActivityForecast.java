package com.wildcam.alerts.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Expected detection count for a species in a given hour of day")
public class ActivityForecast {

    String species;
    int hour;
    boolean hasForecast;
    double expectedCount;
    double stdDev;
    double lowerBound;
    double upperBound;
    int sampleCount;

    public static ActivityForecast none(String species, int hour, int sampleCount) {
        return ActivityForecast.builder()
                .species(species)
                .hour(hour)
                .hasForecast(false)
                .sampleCount(sampleCount)
                .build();
    }
}
