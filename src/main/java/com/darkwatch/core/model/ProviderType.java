package com.darkwatch.core.model;

/**
 * Threat intelligence vendors a {@link Source} can be backed by.
 */
public enum ProviderType {
    CONSTELLA,
    INTSIGHTS,
    DEHASHED,
    CUSTOM
}
