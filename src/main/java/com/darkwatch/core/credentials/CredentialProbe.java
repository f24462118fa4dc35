package com.darkwatch.core.credentials;

import com.darkwatch.core.model.Credentials;

/**
 * Live check of credentials against the provider, typically a cheap authenticated call.
 */
@FunctionalInterface
public interface CredentialProbe {

    boolean verify(Credentials credentials) throws Exception;
}
