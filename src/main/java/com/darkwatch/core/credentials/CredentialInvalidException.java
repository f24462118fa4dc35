package com.darkwatch.core.credentials;

/**
 * Credentials failed validation and a rotation did not produce valid ones either.
 * Fatal for the source; callers must not loop on it.
 */
public class CredentialInvalidException extends RuntimeException {

    private final String secretId;

    public CredentialInvalidException(String secretId, String message) {
        super(message);
        this.secretId = secretId;
    }

    public String getSecretId() {
        return secretId;
    }
}
