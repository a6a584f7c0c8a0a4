package com.wildcam.alerts.engine;

import com.wildcam.alerts.model.Severity;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PriorityAssignerTest {

    private final PriorityAssigner assigner = new PriorityAssigner();

    @Test
    void bearAboveThreshold_emergency() {
        assertThat(assigner.calculatePriority("grizzly_bear", 0.90, 0.5)).isEqualTo(Severity.EMERGENCY);
    }

    @Test
    void bearAtThreshold_fallsThroughToLowerTier() {
        // 0.85 is not strictly above the emergency cut-off; ML 0.7 qualifies for WARNING
        assertThat(assigner.calculatePriority("black_bear", 0.85, 0.7)).isEqualTo(Severity.WARNING);
    }

    @Test
    void wolfAboveThreshold_critical() {
        assertThat(assigner.calculatePriority("gray_wolf", 0.80, 0.1)).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void coyoteBelowThreshold_info() {
        assertThat(assigner.calculatePriority("coyote", 0.70, 0.5)).isEqualTo(Severity.INFO);
    }

    @Test
    void anySpeciesWithHighConfidenceAndMl_warning() {
        assertThat(assigner.calculatePriority("elk", 0.65, 0.65)).isEqualTo(Severity.WARNING);
    }

    @Test
    void highConfidenceButNeutralMl_info() {
        assertThat(assigner.calculatePriority("elk", 0.95, 0.5)).isEqualTo(Severity.INFO);
    }

    @Test
    void lowConfidenceDeer_info() {
        assertThat(assigner.calculatePriority("deer", 0.30, 0.9)).isEqualTo(Severity.INFO);
    }

    @Test
    void speciesMatchIsCaseInsensitive() {
        assertThat(assigner.calculatePriority("Bengal_TIGER", 0.99, 0.0)).isEqualTo(Severity.EMERGENCY);
    }
}
