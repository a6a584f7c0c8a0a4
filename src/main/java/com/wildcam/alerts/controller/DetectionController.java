package com.wildcam.alerts.controller;

import com.wildcam.alerts.engine.AlertEvaluationEngine;
import com.wildcam.alerts.model.AlertEvaluation;
import com.wildcam.alerts.model.DetectionEvent;
import com.wildcam.alerts.model.ProcessingOutcome;
import com.wildcam.alerts.service.DeliveryCoordinator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/detections")
@Tag(name = "Detections", description = "Submit wildlife detections for evaluation and alerting")
public class DetectionController {

    private final AlertEvaluationEngine evaluationEngine;
    private final DeliveryCoordinator deliveryCoordinator;

    public DetectionController(AlertEvaluationEngine evaluationEngine, DeliveryCoordinator deliveryCoordinator) {
        this.evaluationEngine = evaluationEngine;
        this.deliveryCoordinator = deliveryCoordinator;
    }

    @Operation(summary = "Evaluate a detection without creating an alert",
            description = "Runs false-positive prediction, severity assignment, environmental suppression " +
                    "and temporal scoring. Nothing is persisted.")
    @PostMapping("/evaluate")
    public ResponseEntity<AlertEvaluation> evaluate(@RequestBody DetectionEvent detection) {
        return ResponseEntity.ok(evaluationEngine.evaluateAlert(detection));
    }

    @Operation(summary = "Process a detection",
            description = "Creates and persists an alert. Unless filtered, notifications are dispatched " +
                    "asynchronously to every matching alert rule. Returns SUCCESS, FILTERED or FAILED.")
    @PostMapping
    public ResponseEntity<ProcessingOutcome> process(@RequestBody DetectionEvent detection) {
        ProcessingOutcome outcome = deliveryCoordinator.processDetectionAlert(detection);
        if (outcome.status() == ProcessingOutcome.Status.FAILED) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(outcome);
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(outcome);
    }
}
