package com.darkwatch.core.credentials;

/**
 * Secret vault call failed. Retrying is left to the caller.
 */
public class VaultException extends RuntimeException {

    private final String secretId;
    private final boolean retryable;

    public VaultException(String secretId, String message, boolean retryable) {
        super(message);
        this.secretId = secretId;
        this.retryable = retryable;
    }

    public VaultException(String secretId, String message, Throwable cause) {
        super(message, cause);
        this.secretId = secretId;
        this.retryable = true;
    }

    public String getSecretId() {
        return secretId;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
