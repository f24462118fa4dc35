package com.darkwatch.core.config;

import com.darkwatch.core.connector.ProviderHttpClient;
import com.darkwatch.core.connector.constella.ConstellaConnector;
import com.darkwatch.core.connector.dehashed.DeHashedConnector;
import com.darkwatch.core.connector.intsights.IntSightsConnector;
import com.darkwatch.core.credentials.CredentialStore;
import com.darkwatch.core.credentials.CredentialVerifier;
import com.darkwatch.core.metrics.DarkwatchMetrics;
import com.darkwatch.core.model.ProviderType;
import com.darkwatch.core.ratelimit.Sleeper;
import com.darkwatch.support.ConnectorFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ConnectorFactory}.
 */
class ConnectorFactoryTest {

    private CredentialStore store;
    private CredentialVerifier verifier;
    private ExecutorService executor;
    private ConnectorFactory factory;

    @BeforeEach
    void setUp() {
        store = mock(CredentialStore.class);
        verifier = mock(CredentialVerifier.class);
        executor = Executors.newSingleThreadExecutor();
        factory = new ConnectorFactory(store, verifier, new ProviderHttpClient(new ObjectMapper()), executor,
                Clock.systemUTC(), Sleeper.SYSTEM, new DarkwatchMetrics(new SimpleMeterRegistry()));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("builds the vendor connector for each built-in provider")
    void builtInProviders() {
        assertInstanceOf(ConstellaConnector.class,
                factory.create(ConnectorFixtures.source("constella", ProviderType.CONSTELLA)));
        assertInstanceOf(IntSightsConnector.class,
                factory.create(ConnectorFixtures.source("intsights", ProviderType.INTSIGHTS)));
        assertInstanceOf(DeHashedConnector.class,
                factory.create(ConnectorFixtures.source("dehashed", ProviderType.DEHASHED)));
    }

    @Test
    @DisplayName("registers provider rules and a verification probe for the credential reference")
    void wiresCredentials() {
        var connector = factory.create(ConnectorFixtures.source("constella", ProviderType.CONSTELLA));

        assertEquals("constella", connector.sourceId());
        verify(store).registerProvider("constella", ProviderType.CONSTELLA);
        verify(verifier).registerProbe(eq("constella"), any());
    }

    @Test
    @DisplayName("custom sources have no built-in connector")
    void customRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> factory.create(ConnectorFixtures.source("mine", ProviderType.CUSTOM)));
        verify(store, never()).registerProvider(any(), any());
    }

    @Test
    @DisplayName("created connectors honour the source deadline settings")
    void sourceSettingsKept() {
        var source = ConnectorFixtures.source("dehashed", ProviderType.DEHASHED);

        var connector = factory.create(source);

        assertSame(source, connector.source());
        assertEquals(Duration.ofMinutes(1), connector.source().requestDeadline());
    }
}
