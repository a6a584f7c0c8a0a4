package com.wildcam.alerts.model;

public enum AnomalyType {
    INSUFFICIENT_DATA,
    INSUFFICIENT_BASELINE,
    NORMAL,
    UNUSUAL_HIGH_ACTIVITY,
    UNUSUAL_LOW_ACTIVITY,
    UNUSUAL_TIMING
}
