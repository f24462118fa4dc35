package com.darkwatch.core.credentials;

/**
 * The vault could not rotate a secret.
 */
public class CredentialRotationException extends RuntimeException {

    private final String secretId;

    public CredentialRotationException(String secretId, String message, Throwable cause) {
        super(message, cause);
        this.secretId = secretId;
    }

    public String getSecretId() {
        return secretId;
    }
}
