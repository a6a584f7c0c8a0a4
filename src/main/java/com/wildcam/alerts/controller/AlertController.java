package com.wildcam.alerts.controller;

import com.wildcam.alerts.model.Alert;
import com.wildcam.alerts.model.DeliveryRecord;
import com.wildcam.alerts.model.Severity;
import com.wildcam.alerts.service.AlertService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Query alerts, record user feedback and manage alert lifecycle")
public class AlertController {

    private final AlertService alertService;

    public AlertController(AlertService alertService) {
        this.alertService = alertService;
    }

    @Operation(summary = "Get an alert by ID")
    @GetMapping("/{alertId}")
    public ResponseEntity<Alert> getAlert(
            @Parameter(description = "Alert ID", example = "ALT-DET-000123")
            @PathVariable String alertId) {
        return ResponseEntity.ok(alertService.getAlert(alertId));
    }

    @Operation(summary = "List delivery outcomes for an alert",
            description = "One record per channel target with final status, attempt count and last error.")
    @GetMapping("/{alertId}/deliveries")
    public ResponseEntity<List<DeliveryRecord>> getDeliveries(@PathVariable String alertId) {
        return ResponseEntity.ok(alertService.getDeliveries(alertId));
    }

    @Operation(summary = "List active alerts",
            description = "Unresolved, unfiltered alerts, newest first.")
    @GetMapping
    public ResponseEntity<?> getActiveAlerts(
            @Parameter(description = "Restrict to one camera", example = "CAM-07")
            @RequestParam(required = false) String cameraId,
            @Parameter(description = "Restrict to one severity", example = "critical")
            @RequestParam(required = false) String severity,
            @RequestParam(defaultValue = "50") int limit) {
        Severity level;
        try {
            level = Severity.fromValue(severity);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid severity: " + severity));
        }
        if (limit <= 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "limit must be positive"));
        }
        List<Alert> alerts = alertService.getActiveAlerts(cameraId, level, limit);
        return ResponseEntity.ok(alerts);
    }

    @Operation(summary = "Submit feedback for an alert",
            description = "Marks the alert as a false positive or a genuine detection. The detection's " +
                    "features are added to the pattern memory used for future false-positive prediction.")
    @PostMapping("/{alertId}/feedback")
    public ResponseEntity<?> submitFeedback(@PathVariable String alertId,
                                            @RequestBody Map<String, Object> body) {
        Object value = body.get("isFalsePositive");
        if (!(value instanceof Boolean falsePositive)) {
            return ResponseEntity.badRequest().body(Map.of("error", "isFalsePositive (boolean) is required"));
        }
        return ResponseEntity.ok(alertService.processFeedback(alertId, falsePositive));
    }

    @Operation(summary = "Acknowledge an alert")
    @PostMapping("/{alertId}/acknowledge")
    public ResponseEntity<Alert> acknowledge(@PathVariable String alertId) {
        return ResponseEntity.ok(alertService.acknowledge(alertId));
    }

    @Operation(summary = "Resolve an alert",
            description = "Resolved alerts leave the active list and become eligible for retention cleanup.")
    @PostMapping("/{alertId}/resolve")
    public ResponseEntity<Alert> resolve(@PathVariable String alertId) {
        return ResponseEntity.ok(alertService.resolve(alertId));
    }
}
