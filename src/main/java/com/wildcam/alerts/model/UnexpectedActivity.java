package com.wildcam.alerts.model;

public record UnexpectedActivity(boolean unexpected, double deviation, ActivityForecast forecast) {
}
