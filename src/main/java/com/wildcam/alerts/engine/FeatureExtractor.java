package com.wildcam.alerts.engine;

import com.wildcam.alerts.exception.InvalidDetectionException;
import com.wildcam.alerts.model.DetectionEvent;
import com.wildcam.alerts.model.FeatureVector;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Extracts the 9-dimensional feature vector from a detection.
 *
 * Features:
 *   [0] Detection confidence
 *   [1] Hour of day (UTC) / 24
 *   [2] Day flag: 1.0 when 6 <= hour <= 18
 *   [3] Temperature / 50
 *   [4] Humidity / 100
 *   [5] Wind speed / 50
 *   [6] Motion level
 *   [7] Motion duration / 10
 *   [8] Dangerous species flag
 */
public final class FeatureExtractor {

    public static final List<String> DANGEROUS_SPECIES =
            List.of("bear", "wolf", "mountain_lion", "cougar", "tiger", "leopard");

    private FeatureExtractor() {
    }

    public static FeatureVector extract(DetectionEvent detection) {
        double[] features = new double[FeatureVector.LENGTH];

        features[0] = detection.getConfidence();

        int hour = parseTimestamp(detection.getTimestamp()).atZone(ZoneOffset.UTC).getHour();
        features[1] = hour / 24.0;
        features[2] = (hour >= 6 && hour <= 18) ? 1.0 : 0.0;

        DetectionEvent.WeatherContext weather = detection.getWeather();
        features[3] = weather.getTemperature() / 50.0;
        features[4] = weather.getHumidity() / 100.0;
        features[5] = weather.getWindSpeed() / 50.0;

        DetectionEvent.MotionContext motion = detection.getMotion();
        features[6] = motion.getLevel();
        features[7] = motion.getDuration() / 10.0;

        features[8] = isDangerous(detection.getSpecies()) ? 1.0 : 0.0;

        return new FeatureVector(features);
    }

    /**
     * Parse an ISO-8601 timestamp. Values with {@code Z} or an explicit offset are
     * honoured; naive date-times are read as UTC. Anything else is rejected.
     */
    public static Instant parseTimestamp(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            throw new InvalidDetectionException("Detection timestamp is required");
        }
        String value = timestamp.trim();
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException nested) {
                throw new InvalidDetectionException("Unparseable detection timestamp: " + timestamp, nested);
            }
        }
    }

    static boolean isDangerous(String species) {
        if (species == null) return false;
        String lower = species.toLowerCase(Locale.ROOT);
        return DANGEROUS_SPECIES.stream().anyMatch(lower::contains);
    }
}
