package com.wildcam.alerts.controller;

import com.wildcam.alerts.model.ActivityForecast;
import com.wildcam.alerts.model.AnomalyResult;
import com.wildcam.alerts.model.PatternStatistics;
import com.wildcam.alerts.model.UnexpectedActivity;
import com.wildcam.alerts.service.ActivityForecastService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/activity")
@Tag(name = "Activity", description = "Species activity anomalies, forecasts and learned pattern statistics")
public class ActivityController {

    private final ActivityForecastService activityService;

    public ActivityController(ActivityForecastService activityService) {
        this.activityService = activityService;
    }

    @Operation(summary = "Check a species for unusual activity",
            description = "Z-score of the current window's detection count against up to 7 prior windows, " +
                    "plus an hour-of-day timing check. Returns INSUFFICIENT_DATA or INSUFFICIENT_BASELINE " +
                    "until enough history exists.")
    @GetMapping("/{species}/anomaly")
    public ResponseEntity<?> getAnomaly(
            @Parameter(description = "Species label", example = "grizzly_bear")
            @PathVariable String species,
            @Parameter(description = "Evaluation time (ISO-8601 instant), defaults to now")
            @RequestParam(required = false) String at) {
        Instant when;
        try {
            when = at != null ? Instant.parse(at) : null;
        } catch (DateTimeParseException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid instant: " + at));
        }
        AnomalyResult result = activityService.detectAnomaly(species, when);
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Forecast a species' activity for an hour of day",
            description = "Mean of learned hourly counts with a 2-sigma interval. " +
                    "Pass actualCount to check whether an observed count falls outside the interval.")
    @GetMapping("/{species}/forecast")
    public ResponseEntity<?> getForecast(
            @PathVariable String species,
            @Parameter(description = "Time whose UTC hour is forecast (ISO-8601 instant), defaults to now")
            @RequestParam(required = false) String at,
            @Parameter(description = "Observed count to compare against the forecast")
            @RequestParam(required = false) Double actualCount) {
        Instant when;
        try {
            when = at != null ? Instant.parse(at) : null;
        } catch (DateTimeParseException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid instant: " + at));
        }
        if (actualCount != null) {
            UnexpectedActivity check = activityService.checkActivity(species, when, actualCount);
            return ResponseEntity.ok(check);
        }
        ActivityForecast forecast = activityService.forecast(species, when);
        return ResponseEntity.ok(forecast);
    }

    @Operation(summary = "Learned pattern statistics",
            description = "Number of remembered false-positive and true-positive feature vectors.")
    @GetMapping("/patterns")
    public ResponseEntity<PatternStatistics> getPatternStatistics() {
        return ResponseEntity.ok(activityService.patternStatistics());
    }
}
