package com.darkwatch.core.health;

@FunctionalInterface
public interface HealthAlertListener {

    void onAlert(HealthAlert alert);
}
