package com.darkwatch.core.credentials;

import com.darkwatch.core.model.Credentials;

/**
 * Boundary to the external secret storage backend. Every call is assumed to be a network
 * call with its own latency and failure modes; implementations raise {@link VaultException}.
 */
public interface SecretVault {

    Credentials fetch(String secretId);

    void store(String secretId, Credentials credentials);

    /**
     * Asks the backend to issue fresh key material for {@code secretId}.
     *
     * @return the newly issued credentials
     */
    Credentials rotate(String secretId);
}
