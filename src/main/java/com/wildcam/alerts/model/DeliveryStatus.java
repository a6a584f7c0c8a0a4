package com.wildcam.alerts.model;

public enum DeliveryStatus {
    SUCCESS,
    FAILED,
    SKIPPED
}
