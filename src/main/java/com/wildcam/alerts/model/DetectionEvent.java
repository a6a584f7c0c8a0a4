package com.wildcam.alerts.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A wildlife detection produced by the upstream inference pipeline.
 * Weather and motion context are optional and fall back to neutral defaults.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "A wildlife detection submitted for alert evaluation")
public class DetectionEvent {

    @Schema(description = "Detection identifier assigned by the inference pipeline", example = "DET-000123")
    String detectionId;

    @Schema(description = "Detected species label", example = "grizzly_bear")
    String species;

    @Schema(description = "Inference confidence in [0, 1]", example = "0.91")
    double confidence;

    @Schema(description = "Capture time, ISO-8601. Naive date-times are read as UTC.", example = "2024-06-01T06:15:00Z")
    String timestamp;

    @Schema(description = "Camera that produced the detection", example = "CAM-07")
    String cameraId;

    @Schema(description = "Human-readable location of the camera", example = "North Ridge Trail")
    String locationName;

    @Builder.Default
    @Schema(description = "Weather at capture time")
    WeatherContext weather = WeatherContext.defaults();

    @Builder.Default
    @Schema(description = "Motion trigger metadata")
    MotionContext motion = MotionContext.defaults();

    public WeatherContext getWeather() {
        return weather != null ? weather : WeatherContext.defaults();
    }

    public MotionContext getMotion() {
        return motion != null ? motion : MotionContext.defaults();
    }

    @Value
    @Builder
    @Jacksonized
    public static class WeatherContext {
        @Builder.Default
        double temperature = 20.0;   // Celsius
        @Builder.Default
        double humidity = 50.0;      // percent
        @Builder.Default
        double windSpeed = 0.0;      // km/h
        @Builder.Default
        double visibility = 100.0;   // metres

        public static WeatherContext defaults() {
            return WeatherContext.builder().build();
        }
    }

    @Value
    @Builder
    @Jacksonized
    public static class MotionContext {
        @Builder.Default
        double level = 0.0;
        @Builder.Default
        double duration = 0.0;       // seconds

        public static MotionContext defaults() {
            return MotionContext.builder().build();
        }
    }
}
