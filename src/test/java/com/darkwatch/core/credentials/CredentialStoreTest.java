package com.darkwatch.core.credentials;

import com.darkwatch.core.metrics.DarkwatchMetrics;
import com.darkwatch.core.model.Credentials;
import com.darkwatch.core.model.ProviderType;
import com.darkwatch.core.scheduler.BackgroundScheduler;
import com.darkwatch.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link CredentialStore}.
 */
class CredentialStoreTest {

    private static final String SECRET = "constella";
    private static final Credentials VALID = new Credentials(
            "constella_0123456789abcdef0123456789abcdef", null, null, Map.of(), null);
    private static final Credentials INVALID = Credentials.ofApiKey("short");

    private SecretVault vault;
    private BackgroundScheduler scheduler;
    private SimpleMeterRegistry registry;
    private MutableClock clock;
    private CredentialStore store;

    @BeforeEach
    void setUp() {
        vault = mock(SecretVault.class);
        scheduler = mock(BackgroundScheduler.class);
        registry = new SimpleMeterRegistry();
        clock = MutableClock.at("2024-03-01T12:00:00Z");
        store = new CredentialStore(vault, new CredentialFormatValidator(), scheduler,
                new DarkwatchMetrics(registry), clock,
                Duration.ofHours(1), Duration.ofHours(1), Duration.ofHours(24));
        store.registerProvider(SECRET, ProviderType.CONSTELLA);
    }

    // -- Cache ----------------------------------------------------------

    @Nested
    @DisplayName("Cache")
    class CacheTests {

        @Test
        @DisplayName("serves repeated reads from cache within the TTL")
        void cachesWithinTtl() {
            when(vault.fetch(SECRET)).thenReturn(VALID);

            store.get(SECRET);
            clock.advance(Duration.ofMinutes(59));
            store.get(SECRET);

            verify(vault, times(1)).fetch(SECRET);
        }

        @Test
        @DisplayName("refetches once the TTL has passed")
        void refetchAfterTtl() {
            when(vault.fetch(SECRET)).thenReturn(VALID);

            store.get(SECRET);
            clock.advance(Duration.ofHours(1));
            store.get(SECRET);

            verify(vault, times(2)).fetch(SECRET);
        }

        @Test
        @DisplayName("a credential expiring before the TTL shortens the cache entry")
        void credentialExpiryWins() {
            var shortLived = new Credentials(VALID.apiKey(), null, null, null,
                    clock.instant().plus(Duration.ofMinutes(5)));
            when(vault.fetch(SECRET)).thenReturn(shortLived);

            store.get(SECRET);
            clock.advance(Duration.ofMinutes(6));
            store.get(SECRET);

            verify(vault, times(2)).fetch(SECRET);
        }

        @Test
        @DisplayName("already expired credentials from the vault are rejected, not served")
        void expiredFromVault() {
            var expired = new Credentials(VALID.apiKey(), null, null, null,
                    clock.instant().minus(Duration.ofMinutes(1)));
            when(vault.fetch(SECRET)).thenReturn(expired);

            var ex = assertThrows(CredentialInvalidException.class, () -> store.get(SECRET));
            assertEquals(SECRET, ex.getSecretId());
            assertEquals(0, store.cacheStats().totalCached());
        }

        @Test
        @DisplayName("wraps unexpected vault failures as retryable VaultException")
        void wrapsVaultFailure() {
            when(vault.fetch(SECRET)).thenThrow(new IllegalStateException("connection reset"));

            var ex = assertThrows(VaultException.class, () -> store.get(SECRET));
            assertTrue(ex.isRetryable());
            assertEquals(SECRET, ex.getSecretId());
        }

        @Test
        @DisplayName("cacheStats and cleanup distinguish expired entries")
        void statsAndCleanup() {
            when(vault.fetch(anyString())).thenReturn(VALID);
            store.get("a");
            clock.advance(Duration.ofMinutes(30));
            store.get("b");
            clock.advance(Duration.ofMinutes(31));

            var stats = store.cacheStats();
            assertEquals(2, stats.totalCached());
            assertEquals(1, stats.validEntries());
            assertEquals(1, stats.expiredEntries());

            assertEquals(1, store.cleanupExpiredCache());
            assertEquals(1, store.cacheStats().totalCached());
        }

        @Test
        @DisplayName("clearCache forces the next read to hit the vault")
        void clearCache() {
            when(vault.fetch(SECRET)).thenReturn(VALID);
            store.get(SECRET);

            store.clearCache(SECRET);
            store.get(SECRET);

            verify(vault, times(2)).fetch(SECRET);
        }
    }

    // -- Store ----------------------------------------------------------

    @Nested
    @DisplayName("store")
    class StoreTests {

        @Test
        @DisplayName("rejects credentials without an api key")
        void rejectsMissingKey() {
            assertThrows(IllegalArgumentException.class, () -> store.store(SECRET, Credentials.ofApiKey("")));
            verify(vault, never()).store(any(), any());
        }

        @Test
        @DisplayName("writes through and serves the stored value from cache")
        void writesThrough() {
            store.store(SECRET, VALID);

            assertEquals(VALID, store.get(SECRET));
            verify(vault).store(SECRET, VALID);
            verify(vault, never()).fetch(any());
        }
    }

    // -- Validation and rotation ----------------------------------------

    @Nested
    @DisplayName("getValidatedCredentials")
    class ValidatedTests {

        @Test
        @DisplayName("returns valid credentials without rotating")
        void validNoRotation() {
            when(vault.fetch(SECRET)).thenReturn(VALID);

            assertEquals(VALID, store.getValidatedCredentials(SECRET));
            verify(vault, never()).rotate(any());
            assertTrue(store.credentialHealth(SECRET).valid());
        }

        @Test
        @DisplayName("rotates exactly once when the stored credentials are invalid")
        void rotatesOnce() {
            when(vault.fetch(SECRET)).thenReturn(INVALID, VALID);
            when(vault.rotate(SECRET)).thenReturn(VALID);

            assertEquals(VALID, store.getValidatedCredentials(SECRET));
            verify(vault, times(1)).rotate(SECRET);
            assertEquals(1.0, registry.find("darkwatch.credentials.rotations")
                    .tag("success", "true").counter().count());
        }

        @Test
        @DisplayName("throws when credentials are still invalid after one rotation")
        void invalidAfterRotation() {
            when(vault.fetch(SECRET)).thenReturn(INVALID);
            when(vault.rotate(SECRET)).thenReturn(INVALID);

            var ex = assertThrows(CredentialInvalidException.class, () -> store.getValidatedCredentials(SECRET));
            assertTrue(ex.getMessage().contains("even after rotation"));
            verify(vault, times(1)).rotate(SECRET);
            assertFalse(store.credentialHealth(SECRET).valid());
        }

        @Test
        @DisplayName("a failing vault rotation surfaces as CredentialRotationException")
        void rotationFailure() {
            when(vault.fetch(SECRET)).thenReturn(INVALID);
            when(vault.rotate(SECRET)).thenThrow(new VaultException(SECRET, "vault sealed", false));

            assertThrows(CredentialRotationException.class, () -> store.getValidatedCredentials(SECRET));
            assertEquals(1.0, registry.find("darkwatch.credentials.rotations")
                    .tag("success", "false").counter().count());
        }

        @Test
        @DisplayName("skips revalidation within the validation interval")
        void validationCached() {
            when(vault.fetch(SECRET)).thenReturn(VALID);
            store.getValidatedCredentials(SECRET);
            var firstCheck = store.credentialHealth(SECRET).lastChecked();

            clock.advance(Duration.ofMinutes(10));
            store.getValidatedCredentials(SECRET);

            assertEquals(firstCheck, store.credentialHealth(SECRET).lastChecked());
        }

        @Test
        @DisplayName("material refetched after the cache entry expires is validated again")
        void refetchedMaterialRevalidated() {
            var shortLived = new Credentials(VALID.apiKey(), null, null, null,
                    clock.instant().plus(Duration.ofMinutes(10)));
            when(vault.fetch(SECRET)).thenReturn(shortLived, INVALID, VALID);
            when(vault.rotate(SECRET)).thenReturn(VALID);
            assertEquals(shortLived, store.getValidatedCredentials(SECRET));

            clock.advance(Duration.ofMinutes(20));
            var current = store.getValidatedCredentials(SECRET);

            assertEquals(VALID, current);
            assertNotEquals(INVALID.apiKey(), current.apiKey());
            verify(vault, times(1)).rotate(SECRET);
        }

        @Test
        @DisplayName("expired credentials from the vault trigger one rotation")
        void expiredTriggersRotation() {
            var expired = new Credentials(VALID.apiKey(), null, null, null,
                    clock.instant().minus(Duration.ofMinutes(1)));
            when(vault.fetch(SECRET)).thenReturn(expired, VALID);
            when(vault.rotate(SECRET)).thenReturn(VALID);

            assertEquals(VALID, store.getValidatedCredentials(SECRET));
            verify(vault, times(1)).rotate(SECRET);
            assertTrue(store.credentialHealth(SECRET).valid());
        }

        @Test
        @DisplayName("still expired after rotation surfaces as CredentialInvalidException")
        void expiredAfterRotation() {
            var expired = new Credentials(VALID.apiKey(), null, null, null,
                    clock.instant().minus(Duration.ofMinutes(1)));
            when(vault.fetch(SECRET)).thenReturn(expired);
            when(vault.rotate(SECRET)).thenReturn(expired);

            assertThrows(CredentialInvalidException.class, () -> store.getValidatedCredentials(SECRET));
            verify(vault, times(1)).rotate(SECRET);
        }

        @Test
        @DisplayName("background sweep re-validates previously validated secrets")
        void sweepRevalidates() {
            when(vault.fetch(SECRET)).thenReturn(VALID);
            store.getValidatedCredentials(SECRET);
            clock.advance(Duration.ofHours(2));

            store.revalidateKnownSecrets();

            assertEquals(clock.instant(), store.credentialHealth(SECRET).lastChecked());
        }
    }

    // -- Auto rotation --------------------------------------------------

    @Nested
    @DisplayName("Auto rotation")
    class AutoRotationTests {

        @Test
        @DisplayName("enable schedules a one-shot rotation at the interval")
        void enableSchedules() {
            store.enableAutoRotation(SECRET);

            verify(scheduler).scheduleOnce(eq("credential-rotation:" + SECRET), any(Runnable.class),
                    eq(Duration.ofHours(24)));
            var health = store.credentialHealth(SECRET);
            assertTrue(health.rotationEnabled());
            assertEquals(Instant.parse("2024-03-02T12:00:00Z"), health.nextRotation());
        }

        @Test
        @DisplayName("a manual rotation re-arms the timer")
        void rotationRearms() {
            when(vault.rotate(SECRET)).thenReturn(VALID);
            store.enableAutoRotation(SECRET);

            store.rotate(SECRET);

            verify(scheduler, times(2)).scheduleOnce(eq("credential-rotation:" + SECRET),
                    any(Runnable.class), any(Duration.class));
        }

        @Test
        @DisplayName("disable cancels the pending rotation")
        void disableCancels() {
            store.enableAutoRotation(SECRET);
            store.disableAutoRotation(SECRET);

            verify(scheduler).cancel("credential-rotation:" + SECRET);
            assertFalse(store.isAutoRotationEnabled(SECRET));
            assertNull(store.credentialHealth(SECRET).nextRotation());
        }

        @Test
        @DisplayName("destroy cancels every timer and the sweep")
        void destroyCancels() {
            store.enableAutoRotation(SECRET);
            store.startValidationSweep(Duration.ofHours(1));

            store.destroy();

            verify(scheduler).cancelAll("credential-rotation:");
            verify(scheduler).cancel("credential-validation-sweep");
            assertTrue(store.allCredentialHealth().isEmpty());
        }
    }
}
