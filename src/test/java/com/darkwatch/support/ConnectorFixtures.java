package com.darkwatch.support;

import com.darkwatch.core.connector.ConnectorRuntime;
import com.darkwatch.core.connector.ProviderHttpClient;
import com.darkwatch.core.credentials.CredentialStore;
import com.darkwatch.core.metrics.DarkwatchMetrics;
import com.darkwatch.core.model.ProviderType;
import com.darkwatch.core.model.RateLimitConfig;
import com.darkwatch.core.model.RetryConfig;
import com.darkwatch.core.model.Source;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

/**
 * Builds connector runtimes that run synchronously against a {@link StubHttpClient}.
 */
public final class ConnectorFixtures {

    private ConnectorFixtures() {
    }

    public static Source source(String id, ProviderType type) {
        return new Source(id, id, type, "https://" + id + ".example.com",
                new RateLimitConfig(6000, 0, 0, 100),
                new RetryConfig(2, Duration.ofMillis(100), Duration.ofSeconds(5), 2.0),
                id, Duration.ofSeconds(5), Duration.ofMinutes(1), true);
    }

    public static ConnectorRuntime runtime(Source source, CredentialStore store, StubHttpClient http,
                                           MutableClock clock, RecordingSleeper sleeper) {
        return new ConnectorRuntime(source, store,
                new ProviderHttpClient(http.client(), new ObjectMapper()),
                Runnable::run, clock, sleeper, new DarkwatchMetrics(new SimpleMeterRegistry()));
    }
}
