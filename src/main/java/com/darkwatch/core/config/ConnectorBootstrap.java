package com.darkwatch.core.config;

import com.darkwatch.core.credentials.CredentialStore;
import com.darkwatch.core.registry.ConnectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Registers every enabled configured source and starts the background health checks.
 * A source that fails to initialize is logged and skipped; the others still register.
 */
@Component
public class ConnectorBootstrap {

    private static final Logger log = LoggerFactory.getLogger(ConnectorBootstrap.class);

    private final DarkwatchProperties properties;
    private final ConnectorFactory factory;
    private final ConnectorRegistry registry;
    private final CredentialStore credentialStore;
    private volatile boolean started;

    public ConnectorBootstrap(DarkwatchProperties properties, ConnectorFactory factory,
                              ConnectorRegistry registry, CredentialStore credentialStore) {
        this.properties = properties;
        this.factory = factory;
        this.registry = registry;
        this.credentialStore = credentialStore;
    }

    /**
     * Idempotent; commands call it before touching the registry.
     *
     * @return number of sources registered by this call
     */
    public synchronized int start() {
        if (started) {
            return 0;
        }
        started = true;

        var pending = new ArrayList<CompletableFuture<Boolean>>();
        properties.getSources().forEach((id, settings) -> {
            if (!settings.isEnabled()) {
                log.info("Source {} is disabled, skipping", id);
                return;
            }
            var source = settings.toSource(id);
            try {
                var connector = factory.create(source);
                pending.add(registry.register(id, connector)
                        .thenApply(v -> true)
                        .exceptionally(e -> {
                            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                            log.error("Source {} not registered: {}", id, cause.getMessage());
                            return false;
                        }));
                if (properties.getCredentials().isAutoRotation()) {
                    credentialStore.enableAutoRotation(source.credentialRef());
                }
            } catch (IllegalArgumentException e) {
                log.error("Source {} not registered: {}", id, e.getMessage());
            }
        });

        int registered = (int) pending.stream().map(CompletableFuture::join).filter(Boolean::booleanValue).count();
        credentialStore.startValidationSweep(properties.getCredentials().getValidationInterval());
        registry.startHealthMonitoring(properties.getHealthCheckInterval());
        log.info("Registered {} of {} configured sources", registered, properties.getSources().size());
        return registered;
    }

    public boolean isStarted() {
        return started;
    }
}
