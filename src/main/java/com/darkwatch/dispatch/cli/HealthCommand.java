package com.darkwatch.dispatch.cli;

import com.darkwatch.core.config.ConnectorBootstrap;
import com.darkwatch.core.credentials.CredentialStore;
import com.darkwatch.core.credentials.CredentialVerifier;
import com.darkwatch.core.health.HealthMonitor;
import com.darkwatch.core.registry.ConnectorRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: darkwatch health
 * <p>
 * Runs one health check against every registered source and prints the outcome.
 * Exits non-zero when sources are registered but none is healthy. With
 * {@code --verify-credentials} each source's credentials are also checked live against the provider.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check source health")
@Component
public class HealthCommand implements Callable<Integer> {

    @Option(names = {"--verify-credentials"}, description = "Also verify each source's credentials with the provider")
    boolean verifyCredentials;

    private final ConnectorBootstrap bootstrap;
    private final ConnectorRegistry registry;
    private final HealthMonitor healthMonitor;
    private final CredentialStore credentialStore;
    private final CredentialVerifier credentialVerifier;

    public HealthCommand(ConnectorBootstrap bootstrap, ConnectorRegistry registry, HealthMonitor healthMonitor,
                         CredentialStore credentialStore, CredentialVerifier credentialVerifier) {
        this.bootstrap = bootstrap;
        this.registry = registry;
        this.healthMonitor = healthMonitor;
        this.credentialStore = credentialStore;
        this.credentialVerifier = credentialVerifier;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        bootstrap.start();

        if (registry.allConnectors().isEmpty()) {
            ConsoleOutput.error("No sources registered");
            return 1;
        }

        registry.performHealthChecks().join();
        registry.allHealthStatuses().forEach(ConsoleOutput::sourceHealth);
        if (verifyCredentials) {
            verifyAll();
        }

        var stats = registry.registryStats();
        ConsoleOutput.registryStats(stats);
        var system = healthMonitor.systemHealth();
        ConsoleOutput.info(String.format("Uptime %.0f%%, average response %.0fms",
                system.overallUptime() * 100, system.averageResponseTimeMs()));

        if (stats.healthyConnectors() == 0) {
            ConsoleOutput.error("Overall: no healthy sources");
            return 2;
        }
        ConsoleOutput.success("Overall: " + stats.healthyConnectors() + " source(s) available");
        return 0;
    }

    private void verifyAll() {
        for (var connector : registry.allConnectors()) {
            String secretId = connector.source().credentialRef();
            try {
                ConsoleOutput.verification(credentialVerifier.verify(secretId, credentialStore.get(secretId)));
            } catch (RuntimeException e) {
                ConsoleOutput.error(secretId + ": credentials unavailable (" + e.getMessage() + ")");
            }
        }
    }
}
