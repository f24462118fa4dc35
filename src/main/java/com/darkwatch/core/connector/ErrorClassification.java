package com.darkwatch.core.connector;

/**
 * @param errorCode stable code surfaced on {@link ConnectorException}, e.g. {@code HTTP_503}
 */
public record ErrorClassification(ErrorKind kind, String errorCode) {

    public boolean retryable() {
        return kind.isRetryable();
    }

    public boolean rateLimited() {
        return kind == ErrorKind.RATE_LIMITED;
    }
}
