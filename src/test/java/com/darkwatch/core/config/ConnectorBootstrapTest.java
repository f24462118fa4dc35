package com.darkwatch.core.config;

import com.darkwatch.core.connector.ConnectorException;
import com.darkwatch.core.credentials.CredentialStore;
import com.darkwatch.core.model.ProviderType;
import com.darkwatch.core.model.Source;
import com.darkwatch.core.registry.ConnectorRegistry;
import com.darkwatch.support.FakeConnector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ConnectorBootstrap}.
 */
class ConnectorBootstrapTest {

    private DarkwatchProperties properties;
    private ConnectorFactory factory;
    private ConnectorRegistry registry;
    private CredentialStore store;
    private ConnectorBootstrap bootstrap;

    @BeforeEach
    void setUp() {
        properties = new DarkwatchProperties();
        factory = mock(ConnectorFactory.class);
        registry = mock(ConnectorRegistry.class);
        store = mock(CredentialStore.class);
        bootstrap = new ConnectorBootstrap(properties, factory, registry, store);
    }

    private static DarkwatchProperties.SourceSettings settings(ProviderType type, boolean enabled) {
        var settings = new DarkwatchProperties.SourceSettings();
        settings.setProvider(type);
        settings.setBaseUrl("https://" + type.name().toLowerCase() + ".example.com");
        settings.setEnabled(enabled);
        return settings;
    }

    @Test
    @DisplayName("registers enabled sources, skips failures and starts background work")
    void startsEnabledSources() {
        var sources = new LinkedHashMap<String, DarkwatchProperties.SourceSettings>();
        sources.put("constella", settings(ProviderType.CONSTELLA, true));
        sources.put("intsights", settings(ProviderType.INTSIGHTS, false));
        sources.put("dehashed", settings(ProviderType.DEHASHED, true));
        properties.setSources(sources);

        when(factory.create(any(Source.class))).thenAnswer(inv -> new FakeConnector(((Source) inv.getArgument(0)).id(), true));
        when(registry.register(eq("constella"), any())).thenReturn(CompletableFuture.completedFuture(null));
        when(registry.register(eq("dehashed"), any())).thenReturn(CompletableFuture.failedFuture(
                new ConnectorException("vault sealed", "dehashed", ConnectorException.INIT_FAILED, false)));

        int registered = bootstrap.start();

        assertEquals(1, registered);
        verify(factory, times(2)).create(any(Source.class));
        verify(registry, never()).register(eq("intsights"), any());
        verify(store).startValidationSweep(Duration.ofHours(1));
        verify(registry).startHealthMonitoring(Duration.ofMinutes(5));
        verify(store, never()).enableAutoRotation(any());
    }

    @Test
    @DisplayName("is idempotent")
    void idempotent() {
        bootstrap.start();

        assertEquals(0, bootstrap.start());
        assertTrue(bootstrap.isStarted());
        verify(registry, times(1)).startHealthMonitoring(any());
    }

    @Test
    @DisplayName("enables auto rotation when configured")
    void autoRotation() {
        properties.getCredentials().setAutoRotation(true);
        var sources = new LinkedHashMap<String, DarkwatchProperties.SourceSettings>();
        sources.put("constella", settings(ProviderType.CONSTELLA, true));
        properties.setSources(sources);
        when(factory.create(any(Source.class))).thenReturn(new FakeConnector("constella", true));
        when(registry.register(eq("constella"), any())).thenReturn(CompletableFuture.completedFuture(null));

        bootstrap.start();

        verify(store).enableAutoRotation("constella");
    }

    @Test
    @DisplayName("a source without a built-in connector is logged and skipped")
    void unsupportedProvider() {
        var sources = new LinkedHashMap<String, DarkwatchProperties.SourceSettings>();
        sources.put("mine", settings(ProviderType.CUSTOM, true));
        properties.setSources(sources);
        when(factory.create(any(Source.class))).thenThrow(new IllegalArgumentException("no built-in connector"));

        assertEquals(0, bootstrap.start());
        verify(registry).startHealthMonitoring(any());
    }
}
