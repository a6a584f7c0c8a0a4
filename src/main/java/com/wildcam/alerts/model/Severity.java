package com.wildcam.alerts.model;

/**
 * Ordered alert classification: INFO < WARNING < CRITICAL < EMERGENCY.
 */
public enum Severity {
    INFO("low"),
    WARNING("normal"),
    CRITICAL("high"),
    EMERGENCY("high");

    private final String priority;

    Severity(String priority) {
        this.priority = priority;
    }

    /**
     * Routing priority used in notification payloads (high / normal / low).
     */
    public String getPriority() {
        return priority;
    }

    public String getValue() {
        return name().toLowerCase();
    }

    public static Severity fromValue(String value) {
        if (value == null) return null;
        return Severity.valueOf(value.trim().toUpperCase());
    }
}
