package com.darkwatch.core.connector;

import com.darkwatch.core.model.Credentials;

/**
 * One attempt at a provider request with the credentials current for that attempt.
 */
@FunctionalInterface
public interface ProviderCall<T> {

    T call(Credentials credentials) throws Exception;
}
