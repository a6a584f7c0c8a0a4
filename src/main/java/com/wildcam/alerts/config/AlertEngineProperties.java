package com.wildcam.alerts.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Tunables for evaluation, activity baselines and the maintenance jobs.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "alerts")
public class AlertEngineProperties {

    private Pattern pattern = new Pattern();

    private Environment environment = new Environment();

    private Anomaly anomaly = new Anomaly();

    private Forecast forecast = new Forecast();

    private Filtering filtering = new Filtering();

    // How often (in seconds) to refresh the in-memory alert rule cache from Aerospike.
    private int ruleCacheRefreshSeconds = 60;

    private Retention retention = new Retention();

    private Correlation correlation = new Correlation();

    @Data
    public static class Pattern {
        // Max remembered feature vectors per label; oldest evicted first
        private int capacity = 200;
        // Only the most recent N vectors per label take part in similarity
        private int similarityWindow = 50;
        private double falsePositiveSimilarity = 0.75;
        private double truePositiveSimilarity = 0.7;
    }

    @Data
    public static class Environment {
        private double minTemperature = -5.0;
        private double maxTemperature = 40.0;
        private double maxWindSpeed = 40.0;
        private double minVisibility = 10.0;
        // When false, weather never filters an EMERGENCY detection that is not a predicted false positive
        private boolean suppressEmergency = true;
    }

    @Data
    public static class Anomaly {
        private int windowHours = 24;
        private int baselineWindows = 7;
        private int minPoints = 10;
        private int minBaselineWindows = 3;
        private double zThreshold = 2.5;
        private double minStdDev = 0.1;
        private double minConfidence = 0.5;
        private int timingMinPoints = 20;
        private double timingRatio = 0.2;
    }

    @Data
    public static class Forecast {
        private int capacity = 100;
        private int minSamples = 3;
        private double intervalSigmas = 2.0;
    }

    @Data
    public static class Filtering {
        // Predicted false positives are dropped above this score
        private double falsePositiveScore = 0.8;
        // INFO alerts below this pattern confidence are dropped
        private double infoMinConfidence = 0.4;
    }

    @Data
    public static class Retention {
        private int daysToKeep = 90;
    }

    @Data
    public static class Correlation {
        // Recent alerts of the same camera and species within this window share a group
        private int windowMinutes = 10;
        // A grouped alert this close to an earlier one is marked as its duplicate
        private int duplicateWindowMinutes = 5;
    }
}
