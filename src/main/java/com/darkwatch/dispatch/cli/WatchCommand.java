package com.darkwatch.dispatch.cli;

import com.darkwatch.core.config.ConnectorBootstrap;
import com.darkwatch.core.health.HealthAlertType;
import com.darkwatch.core.health.HealthMonitor;
import com.darkwatch.core.registry.ConnectorRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.Callable;

/**
 * CLI command: darkwatch watch
 * <p>
 * Repeats registry health checks and prints every alert the health monitor raises.
 */
@Command(name = "watch", mixinStandardHelpOptions = true, description = "Watch source health and print alerts")
@Component
public class WatchCommand implements Callable<Integer> {

    @Option(names = {"--interval", "-i"}, description = "Seconds between checks (default: ${DEFAULT-VALUE})",
            defaultValue = "60")
    long intervalSeconds;

    @Option(names = {"--rounds", "-n"}, description = "Stop after this many rounds, 0 runs until interrupted",
            defaultValue = "0")
    int rounds;

    private final ConnectorBootstrap bootstrap;
    private final ConnectorRegistry registry;
    private final HealthMonitor healthMonitor;

    public WatchCommand(ConnectorBootstrap bootstrap, ConnectorRegistry registry, HealthMonitor healthMonitor) {
        this.bootstrap = bootstrap;
        this.registry = registry;
        this.healthMonitor = healthMonitor;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (intervalSeconds < 1) {
            ConsoleOutput.error("--interval must be at least 1 second");
            return 1;
        }
        bootstrap.start();

        var subscriptions = new ArrayList<HealthMonitor.Subscription>();
        for (var type : HealthAlertType.values()) {
            subscriptions.add(healthMonitor.registerAlertCallback(type, ConsoleOutput::alert));
        }
        ConsoleOutput.info("Watching " + registry.allConnectors().size() + " source(s) every " + intervalSeconds + "s");
        try {
            for (int round = 1; rounds == 0 || round <= rounds; round++) {
                registry.performHealthChecks().join();
                ConsoleOutput.registryStats(registry.registryStats());
                if (rounds != 0 && round == rounds) {
                    break;
                }
                Thread.sleep(Duration.ofSeconds(intervalSeconds).toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Watch interrupted");
        } finally {
            subscriptions.forEach(HealthMonitor.Subscription::unsubscribe);
        }
        return 0;
    }
}
