package com.wildcam.alerts.model;

public enum Recommendation {
    SUPPRESS("High probability false positive with poor environmental conditions"),
    REVIEW("Possible false positive, manual review recommended"),
    IMMEDIATE_ACTION("Critical wildlife detection requiring urgent response"),
    ALERT("Significant detection during active period"),
    QUEUE("Valid detection but poor conditions, queue for review"),
    LOG("Unusual timing, log for pattern analysis"),
    NOTIFY("Standard alert notification");

    private final String description;

    Recommendation(String description) {
        this.description = description;
    }

    public String toDisplayString() {
        return name().replace('_', ' ') + " - " + description;
    }
}
