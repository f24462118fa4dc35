package com.darkwatch.core.credentials;

import com.darkwatch.core.model.Credentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local vault seeded from configuration. Rotation keeps the key's vendor prefix
 * (everything up to and including the first {@code '_'}) and replaces the rest with
 * 40 random hex characters.
 */
public class InMemorySecretVault implements SecretVault {

    private static final Logger log = LoggerFactory.getLogger(InMemorySecretVault.class);

    private static final int ROTATED_HEX_BYTES = 20;

    private final Map<String, Credentials> secrets = new ConcurrentHashMap<>();
    private final SecureRandom random = new SecureRandom();

    public InMemorySecretVault() {
    }

    public InMemorySecretVault(Map<String, Credentials> seed) {
        if (seed != null) {
            secrets.putAll(seed);
        }
    }

    @Override
    public Credentials fetch(String secretId) {
        var credentials = secrets.get(secretId);
        if (credentials == null) {
            throw new VaultException(secretId, "No secret stored under " + secretId, false);
        }
        return credentials;
    }

    @Override
    public void store(String secretId, Credentials credentials) {
        secrets.put(secretId, credentials);
    }

    @Override
    public Credentials rotate(String secretId) {
        var current = fetch(secretId);
        var rotated = new Credentials(
                regenerate(current.apiKey()),
                current.secret() != null ? regenerate(current.secret()) : null,
                current.token() != null ? regenerate(current.token()) : null,
                current.additionalHeaders(),
                null);
        secrets.put(secretId, rotated);
        log.info("Issued new key material for {}", secretId);
        return rotated;
    }

    public boolean contains(String secretId) {
        return secrets.containsKey(secretId);
    }

    private String regenerate(String previous) {
        byte[] bytes = new byte[ROTATED_HEX_BYTES];
        random.nextBytes(bytes);
        String prefix = "";
        if (previous != null) {
            int underscore = previous.indexOf('_');
            if (underscore >= 0) {
                prefix = previous.substring(0, underscore + 1);
            }
        }
        return prefix + HexFormat.of().formatHex(bytes);
    }
}
