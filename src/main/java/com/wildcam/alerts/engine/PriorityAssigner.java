package com.wildcam.alerts.engine;

import com.wildcam.alerts.model.DetectionEvent;
import com.wildcam.alerts.model.Severity;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Ordered severity table; the first matching tier wins.
 */
@Component
public class PriorityAssigner {

    private static final List<Tier> TIERS = List.of(
            new Tier(Severity.EMERGENCY, List.of("bear", "grizzly", "tiger", "leopard"), 0.85, -1.0),
            new Tier(Severity.CRITICAL, List.of("wolf", "mountain_lion", "cougar", "coyote"), 0.75, -1.0),
            new Tier(Severity.WARNING, List.of(), 0.6, 0.6)
    );

    public Severity calculatePriority(DetectionEvent detection, double mlConfidence) {
        return calculatePriority(detection.getSpecies(), detection.getConfidence(), mlConfidence);
    }

    public Severity calculatePriority(String species, double confidence, double mlConfidence) {
        String lower = species == null ? "" : species.toLowerCase(Locale.ROOT);
        for (Tier tier : TIERS) {
            if (tier.matches(lower, confidence, mlConfidence)) {
                return tier.severity();
            }
        }
        return Severity.INFO;
    }

    /**
     * An empty species list matches any species; a negative ML threshold is ignored.
     */
    private record Tier(Severity severity, List<String> species, double minConfidence, double minMlConfidence) {

        boolean matches(String lowerSpecies, double confidence, double mlConfidence) {
            if (!species.isEmpty() && species.stream().noneMatch(lowerSpecies::contains)) {
                return false;
            }
            if (confidence <= minConfidence) {
                return false;
            }
            return minMlConfidence < 0 || mlConfidence > minMlConfidence;
        }
    }
}
