package com.darkwatch.core.connector;

/**
 * Provider signalled quota exhaustion inside an otherwise successful response.
 */
public class ProviderRateLimitException extends RuntimeException {

    public ProviderRateLimitException(String message) {
        super(message);
    }
}
