package com.darkwatch.core.connector;

import com.darkwatch.core.credentials.CredentialStore;
import com.darkwatch.core.model.Credentials;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Transient reference to a source's credentials. The store stays the owner; the handle
 * re-fetches when empty, after {@link #invalidate()}, or once the reference is older than
 * the refresh interval.
 */
public class CredentialHandle {

    static final Duration REFRESH_INTERVAL = Duration.ofHours(1);

    private final CredentialStore store;
    private final String secretId;
    private final Clock clock;

    private Credentials current;
    private Instant fetchedAt;

    public CredentialHandle(CredentialStore store, String secretId, Clock clock) {
        this.store = store;
        this.secretId = secretId;
        this.clock = clock;
    }

    public synchronized Credentials get() {
        Instant now = clock.instant();
        if (current == null || current.isExpired(now)
                || Duration.between(fetchedAt, now).compareTo(REFRESH_INTERVAL) >= 0) {
            current = store.getValidatedCredentials(secretId);
            fetchedAt = now;
        }
        return current;
    }

    public synchronized void invalidate() {
        current = null;
        fetchedAt = null;
        store.clearCache(secretId);
    }

    public synchronized boolean isPresent() {
        return current != null;
    }

    public String secretId() {
        return secretId;
    }
}
