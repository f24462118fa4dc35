package com.darkwatch.core.connector;

/**
 * How a failed provider call is handled by {@link RequestExecutor}.
 */
public enum ErrorKind {
    /** 401/403: fatal, never retried, cached credential reference dropped. */
    AUTHENTICATION(false),
    /** 429 or an explicit provider signal: retried with backoff, flagged. */
    RATE_LIMITED(true),
    /** Network errors, timeouts, 5xx and unknown failures. */
    TRANSIENT(true),
    /** Any other 4xx. */
    CLIENT(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
