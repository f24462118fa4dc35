package com.darkwatch.core.config;

import com.darkwatch.core.model.ProviderType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link DarkwatchProperties}.
 */
class DarkwatchPropertiesTest {

    private static DarkwatchProperties.SourceSettings constella() {
        var settings = new DarkwatchProperties.SourceSettings();
        settings.setProvider(ProviderType.CONSTELLA);
        settings.setBaseUrl("https://api.constella.example/");
        return settings;
    }

    @Nested
    @DisplayName("Source settings")
    class SourceSettingsTests {

        @Test
        @DisplayName("toSource applies defaults and uses the id as credential reference")
        void defaults() {
            var source = constella().toSource("constella");

            assertEquals("constella", source.credentialRef());
            assertEquals("https://api.constella.example", source.baseUrl());
            assertEquals(60, source.rateLimits().requestsPerMinute());
            assertEquals(10, source.rateLimits().burstCapacity());
            assertEquals(3, source.retry().maxRetries());
            assertEquals(Duration.ofSeconds(1), source.retry().baseDelay());
            assertEquals(0.0, source.retry().jitterFactor());
            assertTrue(source.enabled());
        }

        @Test
        @DisplayName("an explicit credential reference wins")
        void explicitCredentialRef() {
            var settings = constella();
            settings.setCredentialRef("vault/constella-prod");

            assertEquals("vault/constella-prod", settings.toSource("constella").credentialRef());
        }

        @Test
        @DisplayName("provider and base url are required")
        void required() {
            var noProvider = new DarkwatchProperties.SourceSettings();
            noProvider.setBaseUrl("https://x");
            var noUrl = new DarkwatchProperties.SourceSettings();
            noUrl.setProvider(ProviderType.DEHASHED);

            assertThrows(IllegalArgumentException.class, () -> noProvider.toSource("a"));
            assertThrows(IllegalArgumentException.class, () -> noUrl.toSource("b"));
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("defaults are valid")
        void defaultsValid() {
            assertDoesNotThrow(() -> new DarkwatchProperties().validate());
        }

        @Test
        @DisplayName("a broken source fails startup with its id in the message")
        void brokenSource() {
            var properties = new DarkwatchProperties();
            var settings = constella();
            var rateLimit = new DarkwatchProperties.RateLimitSettings();
            rateLimit.setRequestsPerMinute(0);
            settings.setRateLimit(rateLimit);
            properties.setSources(Map.of("constella", settings));

            var ex = assertThrows(IllegalStateException.class, properties::validate);
            assertTrue(ex.getMessage().contains("constella"));
        }

        @Test
        @DisplayName("non-positive intervals are rejected")
        void nonPositiveIntervals() {
            var properties = new DarkwatchProperties();
            properties.setHealthCheckInterval(Duration.ZERO);

            assertThrows(IllegalStateException.class, properties::validate);
        }

        @Test
        @DisplayName("thread counts must be at least one")
        void threads() {
            var properties = new DarkwatchProperties();
            properties.setExecutorThreads(0);

            assertThrows(IllegalStateException.class, properties::validate);
        }
    }

    @Test
    @DisplayName("vault secrets without an api key are skipped")
    void vaultSecrets() {
        var withKey = new DarkwatchProperties.SecretSettings();
        withKey.setApiKey("constella_abc");
        withKey.setSecret(" ");
        var withoutKey = new DarkwatchProperties.SecretSettings();
        withoutKey.setApiKey("");
        var vault = new DarkwatchProperties.VaultSettings();
        vault.setSecrets(Map.of("constella", withKey, "dehashed", withoutKey));

        var credentials = vault.toCredentials();

        assertEquals(1, credentials.size());
        assertEquals("constella_abc", credentials.get("constella").apiKey());
        assertNull(credentials.get("constella").secret());
    }
}
