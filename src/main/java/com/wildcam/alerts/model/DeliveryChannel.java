package com.wildcam.alerts.model;

public enum DeliveryChannel {
    EMAIL,
    PUSH,
    WEBHOOK,
    SMS
}
