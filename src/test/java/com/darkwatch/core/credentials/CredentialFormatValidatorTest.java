package com.darkwatch.core.credentials;

import com.darkwatch.core.model.Credentials;
import com.darkwatch.core.model.ProviderType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CredentialFormatValidator}.
 */
class CredentialFormatValidatorTest {

    private final CredentialFormatValidator validator = new CredentialFormatValidator();

    @Test
    @DisplayName("Constella keys need the vendor prefix and 32 characters")
    void constella() {
        assertTrue(validator.isValid(ProviderType.CONSTELLA,
                Credentials.ofApiKey("constella_0123456789abcdef0123456789")));
        assertFalse(validator.isValid(ProviderType.CONSTELLA,
                Credentials.ofApiKey("0123456789abcdef0123456789abcdef0123")));
        assertFalse(validator.isValid(ProviderType.CONSTELLA, Credentials.ofApiKey("constella_short")));
    }

    @Test
    @DisplayName("IntSights needs both key and secret")
    void intsights() {
        String key = "a".repeat(24);
        assertTrue(validator.isValid(ProviderType.INTSIGHTS, new Credentials(key, key, null, null, null)));
        var problems = validator.violations(ProviderType.INTSIGHTS, Credentials.ofApiKey(key));
        assertEquals(1, problems.size());
        assertTrue(problems.get(0).contains("secret"));
    }

    @Test
    @DisplayName("DeHashed needs a long token alongside the key")
    void dehashed() {
        assertTrue(validator.isValid(ProviderType.DEHASHED,
                new Credentials("k".repeat(16), null, "t".repeat(32), null, null)));
        assertFalse(validator.isValid(ProviderType.DEHASHED,
                new Credentials("k".repeat(16), null, "t".repeat(31), null, null)));
    }

    @Test
    @DisplayName("custom providers need 20 characters")
    void custom() {
        assertTrue(validator.isValid(ProviderType.CUSTOM, Credentials.ofApiKey("x".repeat(20))));
        assertFalse(validator.isValid(ProviderType.CUSTOM, Credentials.ofApiKey("x".repeat(19))));
    }

    @Test
    @DisplayName("missing key short-circuits and messages never echo key material")
    void missingKey() {
        assertEquals(1, validator.violations(ProviderType.CONSTELLA, null).size());
        var problems = validator.violations(ProviderType.CUSTOM, Credentials.ofApiKey("leakme"));
        assertTrue(problems.stream().noneMatch(p -> p.contains("leakme")));
    }
}
