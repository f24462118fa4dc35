package com.darkwatch.core.credentials;

import com.darkwatch.core.model.Credentials;
import com.darkwatch.core.model.ProviderType;

import java.util.ArrayList;
import java.util.List;

/**
 * Cheap local shape checks for provider credentials. No network calls.
 */
public class CredentialFormatValidator {

    static final int MIN_KEY_LENGTH = 10;

    public boolean isValid(ProviderType provider, Credentials credentials) {
        return violations(provider, credentials).isEmpty();
    }

    /**
     * Lists every rule the credentials break. Messages never include key material.
     */
    public List<String> violations(ProviderType provider, Credentials credentials) {
        var problems = new ArrayList<String>();
        if (credentials == null || !credentials.hasApiKey()) {
            problems.add("apiKey is missing");
            return problems;
        }
        String apiKey = credentials.apiKey();
        if (apiKey.length() < MIN_KEY_LENGTH) {
            problems.add("apiKey shorter than " + MIN_KEY_LENGTH + " characters");
        }
        switch (provider == null ? ProviderType.CUSTOM : provider) {
            case CONSTELLA -> {
                if (!apiKey.startsWith("constella_")) {
                    problems.add("Constella apiKey must start with 'constella_'");
                }
                requireLength(problems, "apiKey", apiKey, 32);
            }
            case INTSIGHTS -> {
                requireLength(problems, "apiKey", apiKey, 24);
                requireLength(problems, "secret", credentials.secret(), 24);
            }
            case DEHASHED -> {
                requireLength(problems, "apiKey", apiKey, 16);
                requireLength(problems, "token", credentials.token(), 32);
            }
            case CUSTOM -> requireLength(problems, "apiKey", apiKey, 20);
        }
        return problems;
    }

    private static void requireLength(List<String> problems, String field, String value, int min) {
        if (value == null || value.isBlank()) {
            problems.add(field + " is missing");
        } else if (value.length() < min) {
            problems.add(field + " shorter than " + min + " characters");
        }
    }
}
