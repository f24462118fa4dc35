package com.darkwatch.core.credentials;

import com.darkwatch.core.model.Credentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Caches live verification outcomes per secret. The cache key combines the secret id with a
 * SHA-256 fingerprint of the key material, so rotated credentials are never answered from
 * a stale entry. Only completed probes are cached; a probe that throws is reported invalid
 * and retried on the next call.
 */
public class CredentialVerifier {

    private static final Logger log = LoggerFactory.getLogger(CredentialVerifier.class);

    private final Map<String, CredentialProbe> probes = new ConcurrentHashMap<>();
    private final Map<String, CachedVerification> cache = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong lookups = new AtomicLong();
    private volatile Instant lastVerification;

    public CredentialVerifier(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    public void registerProbe(String secretId, CredentialProbe probe) {
        probes.put(secretId, probe);
    }

    public VerificationResult verify(String secretId, Credentials credentials) {
        lookups.incrementAndGet();
        Instant now = clock.instant();
        String key = cacheKey(secretId, credentials);
        var cached = cache.get(key);
        if (cached != null && cached.expiry().isAfter(now)) {
            hits.incrementAndGet();
            return new VerificationResult(secretId, cached.valid(), cached.checkedAt(), true, null, 0);
        }

        var probe = probes.get(secretId);
        if (probe == null) {
            return new VerificationResult(secretId, false, now, false,
                    "No verification probe registered for " + secretId, 0);
        }

        long start = System.nanoTime();
        boolean valid;
        try {
            valid = probe.verify(credentials);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(secretId, now, start, e);
        } catch (Exception e) {
            return failed(secretId, now, start, e);
        }
        long elapsed = (System.nanoTime() - start) / 1_000_000;
        cache.put(key, new CachedVerification(valid, now, now.plus(ttl)));
        lastVerification = now;
        log.debug("Verified credentials for {}: valid={} in {}ms", secretId, valid, elapsed);
        return new VerificationResult(secretId, valid, now, false, null, elapsed);
    }

    public VerificationStats stats() {
        Instant now = clock.instant();
        int valid = 0;
        int invalid = 0;
        int total = 0;
        for (var entry : cache.values()) {
            if (!entry.expiry().isAfter(now)) {
                continue;
            }
            total++;
            if (entry.valid()) {
                valid++;
            } else {
                invalid++;
            }
        }
        long lookupCount = lookups.get();
        double hitRate = lookupCount == 0 ? 0.0 : (double) hits.get() / lookupCount;
        return new VerificationStats(total, valid, invalid, hitRate, lastVerification);
    }

    public void clearCache() {
        cache.clear();
    }

    public void clearCache(String secretId) {
        cache.keySet().removeIf(k -> k.startsWith(secretId + ":"));
    }

    private VerificationResult failed(String secretId, Instant now, long start, Exception e) {
        long elapsed = (System.nanoTime() - start) / 1_000_000;
        log.warn("Verification probe for {} failed: {}", secretId, e.getMessage());
        return new VerificationResult(secretId, false, now, false,
                e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), elapsed);
    }

    static String cacheKey(String secretId, Credentials credentials) {
        String material = credentials == null ? "" : String.valueOf(credentials.apiKey());
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(material.getBytes(StandardCharsets.UTF_8));
            return secretId + ":" + HexFormat.of().formatHex(hash, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private record CachedVerification(boolean valid, Instant checkedAt, Instant expiry) {}
}
