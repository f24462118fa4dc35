package com.darkwatch.core.connector;

/**
 * Terminal failure of one connector operation, after retries where they apply.
 */
public class ConnectorException extends RuntimeException {

    public static final String INIT_FAILED = "INIT_FAILED";
    public static final String DEADLINE_EXCEEDED = "DEADLINE_EXCEEDED";
    public static final String INTERRUPTED = "INTERRUPTED";
    public static final String CREDENTIALS_UNAVAILABLE = "CREDENTIALS_UNAVAILABLE";

    private final String sourceId;
    private final String errorCode;
    private final boolean retryable;
    private final boolean rateLimited;
    private final int attempts;

    public ConnectorException(String message, String sourceId, String errorCode,
                              boolean retryable, boolean rateLimited, int attempts, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
        this.errorCode = errorCode;
        this.retryable = retryable;
        this.rateLimited = rateLimited;
        this.attempts = attempts;
    }

    public ConnectorException(String message, String sourceId, String errorCode, boolean retryable) {
        this(message, sourceId, errorCode, retryable, false, 0, null);
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean isRateLimited() {
        return rateLimited;
    }

    public int getAttempts() {
        return attempts;
    }
}
