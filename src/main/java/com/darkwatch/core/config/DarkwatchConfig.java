package com.darkwatch.core.config;

import com.darkwatch.core.connector.ProviderHttpClient;
import com.darkwatch.core.credentials.CredentialFormatValidator;
import com.darkwatch.core.credentials.CredentialStore;
import com.darkwatch.core.credentials.CredentialVerifier;
import com.darkwatch.core.credentials.InMemorySecretVault;
import com.darkwatch.core.credentials.SecretVault;
import com.darkwatch.core.health.HealthAlertThresholds;
import com.darkwatch.core.health.HealthMonitor;
import com.darkwatch.core.metrics.DarkwatchMetrics;
import com.darkwatch.core.ratelimit.Sleeper;
import com.darkwatch.core.registry.ConnectorRegistry;
import com.darkwatch.core.scheduler.BackgroundScheduler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class DarkwatchConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean(destroyMethod = "shutdown")
    public BackgroundScheduler backgroundScheduler(DarkwatchProperties properties) {
        return new BackgroundScheduler(properties.getSchedulerThreads());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService connectorExecutor(DarkwatchProperties properties) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getExecutorThreads(), r -> {
            Thread t = new Thread(r, "darkwatch-connector-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public ProviderHttpClient providerHttpClient(ObjectMapper objectMapper) {
        return new ProviderHttpClient(objectMapper);
    }

    /**
     * Seeded from {@code darkwatch.vault.secrets}. Replace by declaring another {@link SecretVault} bean.
     */
    @Bean
    @ConditionalOnMissingBean(SecretVault.class)
    public SecretVault secretVault(DarkwatchProperties properties) {
        return new InMemorySecretVault(properties.getVault().toCredentials());
    }

    @Bean(destroyMethod = "destroy")
    public CredentialStore credentialStore(SecretVault vault, BackgroundScheduler scheduler,
                                           DarkwatchMetrics metrics, Clock clock,
                                           DarkwatchProperties properties) {
        var settings = properties.getCredentials();
        return new CredentialStore(vault, new CredentialFormatValidator(), scheduler, metrics, clock,
                settings.getCacheTtl(), settings.getValidationInterval(), settings.getRotationInterval());
    }

    @Bean
    public CredentialVerifier credentialVerifier(Clock clock, DarkwatchProperties properties) {
        return new CredentialVerifier(clock, properties.getCredentials().getVerificationTtl());
    }

    @Bean
    public HealthMonitor healthMonitor(DarkwatchProperties properties, Clock clock, DarkwatchMetrics metrics) {
        var alerts = properties.getAlerts();
        var thresholds = new HealthAlertThresholds(alerts.getErrorRate(), alerts.getResponseTimeMs(),
                alerts.getConsecutiveFailures());
        return new HealthMonitor(thresholds, clock, metrics);
    }

    @Bean(destroyMethod = "destroy")
    public ConnectorRegistry connectorRegistry(HealthMonitor healthMonitor, BackgroundScheduler scheduler,
                                               DarkwatchMetrics metrics, DarkwatchProperties properties) {
        return new ConnectorRegistry(healthMonitor, scheduler, metrics, properties.getFanOutTimeout());
    }
}
