package com.darkwatch.core.config;

import com.darkwatch.core.connector.ConnectorRuntime;
import com.darkwatch.core.connector.ProviderHttpClient;
import com.darkwatch.core.connector.ThreatIntelConnector;
import com.darkwatch.core.connector.constella.ConstellaConnector;
import com.darkwatch.core.connector.dehashed.DeHashedConnector;
import com.darkwatch.core.connector.intsights.IntSightsConnector;
import com.darkwatch.core.credentials.CredentialStore;
import com.darkwatch.core.credentials.CredentialVerifier;
import com.darkwatch.core.metrics.DarkwatchMetrics;
import com.darkwatch.core.model.Source;
import com.darkwatch.core.ratelimit.Sleeper;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ExecutorService;

/**
 * Builds the vendor connector for a {@link Source} and wires its credentials into the
 * store and verifier.
 */
@Component
public class ConnectorFactory {

    private final CredentialStore credentialStore;
    private final CredentialVerifier credentialVerifier;
    private final ProviderHttpClient http;
    private final ExecutorService executor;
    private final Clock clock;
    private final Sleeper sleeper;
    private final DarkwatchMetrics metrics;

    public ConnectorFactory(CredentialStore credentialStore, CredentialVerifier credentialVerifier,
                            ProviderHttpClient http, ExecutorService connectorExecutor,
                            Clock clock, Sleeper sleeper, DarkwatchMetrics metrics) {
        this.credentialStore = credentialStore;
        this.credentialVerifier = credentialVerifier;
        this.http = http;
        this.executor = connectorExecutor;
        this.clock = clock;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    /**
     * @throws IllegalArgumentException for provider types without a built-in connector
     */
    public ThreatIntelConnector create(Source source) {
        var runtime = new ConnectorRuntime(source, credentialStore, http, executor, clock, sleeper, metrics);
        ThreatIntelConnector connector = switch (source.providerType()) {
            case CONSTELLA -> new ConstellaConnector(runtime);
            case INTSIGHTS -> new IntSightsConnector(runtime);
            case DEHASHED -> new DeHashedConnector(runtime);
            case CUSTOM -> throw new IllegalArgumentException(
                    "No built-in connector for custom source " + source.id() + "; register one directly");
        };
        credentialStore.registerProvider(source.credentialRef(), source.providerType());
        credentialVerifier.registerProbe(source.credentialRef(), connector::verifyCredentials);
        return connector;
    }
}
