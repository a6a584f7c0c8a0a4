package com.wildcam.alerts.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Activity anomaly assessment for one species")
public class AnomalyResult {

    String species;
    boolean anomaly;
    AnomalyType anomalyType;
    double zScore;
    double anomalyScore;
    double baselineMean;
    long currentCount;
    int baselineWindows;
    long historyPoints;

    public static AnomalyResult insufficient(String species, AnomalyType type, long historyPoints) {
        return AnomalyResult.builder()
                .species(species)
                .anomaly(false)
                .anomalyType(type)
                .historyPoints(historyPoints)
                .build();
    }
}
