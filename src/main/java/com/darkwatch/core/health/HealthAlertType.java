package com.darkwatch.core.health;

public enum HealthAlertType {
    HIGH_ERROR_RATE,
    HIGH_RESPONSE_TIME,
    CONSECUTIVE_FAILURES,
    SOURCE_RECOVERED
}
