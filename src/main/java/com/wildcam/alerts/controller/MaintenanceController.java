package com.wildcam.alerts.controller;

import com.wildcam.alerts.service.MetricsAggregationService;
import com.wildcam.alerts.service.RetentionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/maintenance")
@Tag(name = "Maintenance", description = "On-demand runs of the retention sweep and daily metrics job")
public class MaintenanceController {

    private final RetentionService retentionService;
    private final MetricsAggregationService metricsAggregationService;

    public MaintenanceController(RetentionService retentionService,
                                 MetricsAggregationService metricsAggregationService) {
        this.retentionService = retentionService;
        this.metricsAggregationService = metricsAggregationService;
    }

    @Operation(summary = "Delete old resolved alerts",
            description = "Deletes alerts resolved more than daysToKeep days ago. All-or-nothing.")
    @PostMapping("/cleanup")
    public ResponseEntity<?> cleanup(@RequestParam(defaultValue = "90") int daysToKeep) {
        if (daysToKeep < 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "daysToKeep must be >= 0"));
        }
        int deleted = retentionService.cleanupOldAlerts(daysToKeep);
        return ResponseEntity.ok(Map.of("deleted", deleted, "daysToKeep", daysToKeep));
    }

    @Operation(summary = "Recompute today's per-camera metrics",
            description = "Recalculates accuracy and false-positive rate from user feedback for every active camera.")
    @PostMapping("/metrics")
    public ResponseEntity<Map<String, Object>> updateMetrics() {
        int cameras = metricsAggregationService.updateDailyMetrics();
        return ResponseEntity.ok(Map.of("camerasUpdated", cameras));
    }
}
