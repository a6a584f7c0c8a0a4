package com.wildcam.alerts.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.util.HashSet;
import java.util.Set;

/**
 * Per-user delivery preferences. A null cameraId makes the rule global.
 * Empty sets mean "no restriction".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Notification routing rule for one user, optionally scoped to a camera")
public class AlertRule {

    @Schema(description = "Rule identifier", example = "RULE-42")
    private String ruleId;

    @Schema(description = "Owning user", example = "ranger-7")
    private String userId;

    @Schema(description = "Camera scope; null for all cameras", example = "CAM-07")
    private String cameraId;

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private Set<Severity> severityLevels = new HashSet<>();

    @Builder.Default
    private Set<String> speciesFilter = new HashSet<>();

    @Schema(description = "Minimum pattern-matching confidence", example = "0.5")
    @Builder.Default
    private double minConfidence = 0.0;

    @Schema(description = "Allowed UTC hours (0-23)")
    @Builder.Default
    private Set<Integer> timeOfDay = new HashSet<>();

    @Builder.Default
    private Set<DayOfWeek> daysOfWeek = new HashSet<>();

    private boolean emailEnabled;

    private String emailAddress;

    private boolean pushEnabled;

    private String webhookUrl;

    private boolean smsEnabled;

    private String phoneNumber;

    @Builder.Default
    private boolean suppressFalsePositives = true;

    public boolean isGlobal() {
        return cameraId == null || cameraId.isBlank();
    }
}
