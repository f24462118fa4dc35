package com.darkwatch.core.credentials;

import com.darkwatch.core.metrics.DarkwatchMetrics;
import com.darkwatch.core.model.Credentials;
import com.darkwatch.core.model.ProviderType;
import com.darkwatch.core.scheduler.BackgroundScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns per-source API credentials: fetches them from the {@link SecretVault}, caches them
 * with a TTL, validates their shape, rotates them on demand or on a timer.
 * <p>
 * A cache entry always carries an expiry (the TTL, or the credential's own expiry when that
 * comes first) and is never returned once past it. Secret values are never logged.
 */
public class CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);

    static final String ROTATION_TASK_PREFIX = "credential-rotation:";
    static final String VALIDATION_SWEEP_TASK = "credential-validation-sweep";

    private final SecretVault vault;
    private final CredentialFormatValidator validator;
    private final BackgroundScheduler scheduler;
    private final DarkwatchMetrics metrics;
    private final Clock clock;
    private final Duration cacheTtl;
    private final Duration validationInterval;
    private final Duration rotationInterval;

    private final ConcurrentHashMap<String, CachedCredentials> cache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ValidationState> validations = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ProviderType> providers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Instant> nextRotations = new ConcurrentHashMap<>();
    private final Set<String> autoRotation = ConcurrentHashMap.newKeySet();

    public CredentialStore(SecretVault vault, BackgroundScheduler scheduler) {
        this(vault, new CredentialFormatValidator(), scheduler, null, Clock.systemUTC(),
                Duration.ofHours(1), Duration.ofHours(1), Duration.ofHours(24));
    }

    public CredentialStore(SecretVault vault, CredentialFormatValidator validator,
                           BackgroundScheduler scheduler, DarkwatchMetrics metrics, Clock clock,
                           Duration cacheTtl, Duration validationInterval, Duration rotationInterval) {
        this.vault = vault;
        this.validator = validator;
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.clock = clock;
        this.cacheTtl = cacheTtl;
        this.validationInterval = validationInterval;
        this.rotationInterval = rotationInterval;
    }

    /**
     * Associates a secret with the provider whose format rules apply to it.
     */
    public void registerProvider(String secretId, ProviderType providerType) {
        providers.put(secretId, providerType);
    }

    /**
     * Returns cached credentials while unexpired, otherwise fetches once from the vault.
     * A fresh fetch forgets any earlier validation of the secret.
     *
     * @throws VaultException when the vault cannot be reached or has no such secret
     * @throws CredentialInvalidException when the vault hands back already expired credentials
     */
    public Credentials get(String secretId) {
        Instant now = clock.instant();
        var cached = cache.get(secretId);
        if (cached != null && cached.expiry().isAfter(now)) {
            return cached.credentials();
        }

        Credentials fetched;
        try {
            fetched = vault.fetch(secretId);
        } catch (VaultException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new VaultException(secretId, "Failed to retrieve credentials for " + secretId, e);
        }
        if (fetched == null) {
            throw new VaultException(secretId, "Vault returned no credentials for " + secretId, false);
        }
        validations.remove(secretId);
        if (fetched.isExpired(now)) {
            cache.remove(secretId);
            throw new CredentialInvalidException(secretId,
                    "Vault returned credentials for " + secretId + " that expired at " + fetched.expiresAt());
        }
        cache.put(secretId, new CachedCredentials(fetched, expiryFor(fetched, now)));
        log.debug("Fetched and cached credentials for {}", secretId);
        return fetched;
    }

    /**
     * Writes credentials to the vault after a shape check and refreshes the cache entry.
     *
     * @throws IllegalArgumentException when the primary key is missing
     */
    public void store(String secretId, Credentials credentials) {
        if (credentials == null || !credentials.hasApiKey()) {
            throw new IllegalArgumentException("Invalid credentials format for " + secretId + ": apiKey is missing");
        }
        try {
            vault.store(secretId, credentials);
        } catch (VaultException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new VaultException(secretId, "Failed to store credentials for " + secretId, e);
        }
        Instant now = clock.instant();
        cache.put(secretId, new CachedCredentials(credentials, expiryFor(credentials, now)));
        validations.remove(secretId);
        if (autoRotation.contains(secretId)) {
            scheduleRotation(secretId);
        }
        log.info("Stored credentials for {}", secretId);
    }

    /**
     * Issues new credentials through the vault and drops every cached view of the old ones.
     *
     * @throws CredentialRotationException when the vault rotation fails
     */
    public Credentials rotate(String secretId) {
        log.info("Starting credential rotation for {}", secretId);
        Credentials rotated;
        try {
            rotated = vault.rotate(secretId);
        } catch (RuntimeException e) {
            if (metrics != null) {
                metrics.recordCredentialRotation(secretId, false);
            }
            log.error("Credential rotation failed for {}: {}", secretId, e.getMessage());
            throw new CredentialRotationException(secretId,
                    "Failed to rotate credentials for " + secretId + ": " + e.getMessage(), e);
        }
        cache.remove(secretId);
        validations.remove(secretId);
        if (autoRotation.contains(secretId)) {
            scheduleRotation(secretId);
        }
        if (metrics != null) {
            metrics.recordCredentialRotation(secretId, true);
        }
        log.info("Credential rotation completed for {}", secretId);
        return rotated;
    }

    /**
     * Local format check against the rules of the secret's provider.
     */
    public boolean validate(String secretId, Credentials credentials) {
        var provider = providers.getOrDefault(secretId, ProviderType.CUSTOM);
        var problems = validator.violations(provider, credentials);
        if (!problems.isEmpty()) {
            log.warn("Credentials for {} failed validation: {}", secretId, problems);
            return false;
        }
        return true;
    }

    /**
     * Returns credentials that passed validation recently. On a failed validation the secret
     * is rotated exactly once; if the rotated credentials are still invalid this throws.
     *
     * @throws CredentialInvalidException when credentials are invalid even after rotation
     * @throws CredentialRotationException when the rotation itself fails
     */
    public Credentials getValidatedCredentials(String secretId) {
        Instant now = clock.instant();
        Credentials credentials;
        try {
            credentials = get(secretId);
        } catch (CredentialInvalidException e) {
            log.warn("Credentials for {} are expired, attempting rotation", secretId);
            return rotateAndRevalidate(secretId);
        }
        var state = validations.get(secretId);
        if (state != null && state.valid()
                && Duration.between(state.lastChecked(), now).compareTo(validationInterval) < 0) {
            return credentials;
        }

        if (validate(secretId, credentials)) {
            validations.put(secretId, new ValidationState(true, now));
            return credentials;
        }

        log.warn("Credentials for {} are invalid, attempting rotation", secretId);
        return rotateAndRevalidate(secretId);
    }

    private Credentials rotateAndRevalidate(String secretId) {
        rotate(secretId);
        var rotated = get(secretId);
        if (!validate(secretId, rotated)) {
            validations.put(secretId, new ValidationState(false, clock.instant()));
            throw new CredentialInvalidException(secretId,
                    "Credentials for " + secretId + " are invalid even after rotation");
        }
        validations.put(secretId, new ValidationState(true, clock.instant()));
        return rotated;
    }

    public void enableAutoRotation(String secretId) {
        autoRotation.add(secretId);
        scheduleRotation(secretId);
        log.info("Auto rotation enabled for {} (every {})", secretId, rotationInterval);
    }

    public void disableAutoRotation(String secretId) {
        autoRotation.remove(secretId);
        nextRotations.remove(secretId);
        scheduler.cancel(ROTATION_TASK_PREFIX + secretId);
        log.info("Auto rotation disabled for {}", secretId);
    }

    public boolean isAutoRotationEnabled(String secretId) {
        return autoRotation.contains(secretId);
    }

    public CredentialHealth credentialHealth(String secretId) {
        var state = validations.get(secretId);
        return new CredentialHealth(
                secretId,
                state != null && state.valid(),
                state != null ? state.lastChecked() : Instant.EPOCH,
                nextRotations.get(secretId),
                autoRotation.contains(secretId));
    }

    public List<CredentialHealth> allCredentialHealth() {
        var ids = new TreeSet<String>();
        ids.addAll(validations.keySet());
        ids.addAll(autoRotation);
        ids.addAll(cache.keySet());
        var result = new ArrayList<CredentialHealth>();
        for (var id : ids) {
            result.add(credentialHealth(id));
        }
        result.sort(Comparator.comparing(CredentialHealth::secretId));
        return result;
    }

    public CredentialCacheStats cacheStats() {
        Instant now = clock.instant();
        int valid = 0;
        int expired = 0;
        for (var entry : cache.values()) {
            if (entry.expiry().isAfter(now)) {
                valid++;
            } else {
                expired++;
            }
        }
        return new CredentialCacheStats(valid + expired, valid, expired);
    }

    /**
     * Drops expired cache entries.
     *
     * @return number of entries removed
     */
    public int cleanupExpiredCache() {
        Instant now = clock.instant();
        int before = cache.size();
        cache.entrySet().removeIf(e -> !e.getValue().expiry().isAfter(now));
        return before - cache.size();
    }

    public void clearCache(String secretId) {
        cache.remove(secretId);
    }

    public void clearCache() {
        cache.clear();
    }

    /**
     * Periodically re-validates every secret that has been validated before, and evicts
     * expired cache entries.
     */
    public void startValidationSweep(Duration interval) {
        scheduler.scheduleAtFixedRate(VALIDATION_SWEEP_TASK, this::revalidateKnownSecrets, interval, interval);
    }

    void revalidateKnownSecrets() {
        cleanupExpiredCache();
        for (var secretId : Set.copyOf(validations.keySet())) {
            try {
                var credentials = get(secretId);
                validations.put(secretId, new ValidationState(validate(secretId, credentials), clock.instant()));
            } catch (RuntimeException e) {
                log.warn("Background validation failed for {}: {}", secretId, e.getMessage());
            }
        }
    }

    /**
     * Cancels every rotation timer and the validation sweep, and forgets all cached state.
     */
    public void destroy() {
        scheduler.cancelAll(ROTATION_TASK_PREFIX);
        scheduler.cancel(VALIDATION_SWEEP_TASK);
        autoRotation.clear();
        nextRotations.clear();
        validations.clear();
        cache.clear();
        log.info("Credential store destroyed");
    }

    private void scheduleRotation(String secretId) {
        nextRotations.put(secretId, clock.instant().plus(rotationInterval));
        scheduler.scheduleOnce(ROTATION_TASK_PREFIX + secretId, () -> {
            try {
                rotate(secretId);
            } catch (CredentialRotationException e) {
                log.error("Scheduled rotation failed for {}: {}", secretId, e.getMessage());
            }
        }, rotationInterval);
    }

    private Instant expiryFor(Credentials credentials, Instant now) {
        Instant ttlExpiry = now.plus(cacheTtl);
        if (credentials.expiresAt() != null && credentials.expiresAt().isBefore(ttlExpiry)) {
            return credentials.expiresAt();
        }
        return ttlExpiry;
    }

    private record CachedCredentials(Credentials credentials, Instant expiry) {}

    private record ValidationState(boolean valid, Instant lastChecked) {}
}
