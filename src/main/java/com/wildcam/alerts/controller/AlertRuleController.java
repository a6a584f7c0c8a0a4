package com.wildcam.alerts.controller;

import com.wildcam.alerts.model.AlertRule;
import com.wildcam.alerts.service.AlertRuleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/rules")
@Tag(name = "Alert Rules", description = "Manage per-user notification routing rules")
public class AlertRuleController {

    private final AlertRuleService ruleService;

    public AlertRuleController(AlertRuleService ruleService) {
        this.ruleService = ruleService;
    }

    @Operation(summary = "List all alert rules")
    @GetMapping
    public ResponseEntity<List<AlertRule>> listRules() {
        return ResponseEntity.ok(ruleService.getAllRules());
    }

    @Operation(summary = "Get a specific rule by ID")
    @GetMapping("/{ruleId}")
    public ResponseEntity<AlertRule> getRule(
            @Parameter(description = "Rule ID", example = "RULE-42")
            @PathVariable String ruleId) {
        AlertRule rule = ruleService.getRule(ruleId);
        if (rule == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(rule);
    }

    @Operation(summary = "Create an alert rule",
            description = "A rule without cameraId applies to every camera. The delivery rule cache is " +
                    "refreshed immediately, so the rule takes effect for the next alert.")
    @PostMapping
    public ResponseEntity<AlertRule> createRule(@RequestBody AlertRule rule) {
        if (rule.getUserId() == null || rule.getUserId().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(ruleService.createRule(rule));
    }

    @Operation(summary = "Update an existing rule",
            description = "Change filters, channels or enable/disable the rule.")
    @PutMapping("/{ruleId}")
    public ResponseEntity<AlertRule> updateRule(
            @Parameter(description = "Rule ID", example = "RULE-42")
            @PathVariable String ruleId,
            @RequestBody AlertRule updated) {
        AlertRule result = ruleService.updateRule(ruleId, updated);
        if (result == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Delete a rule")
    @DeleteMapping("/{ruleId}")
    public ResponseEntity<Void> deleteRule(
            @Parameter(description = "Rule ID", example = "RULE-42")
            @PathVariable String ruleId) {
        if (!ruleService.deleteRule(ruleId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }
}
