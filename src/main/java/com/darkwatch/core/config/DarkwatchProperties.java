package com.darkwatch.core.config;

import com.darkwatch.core.model.Credentials;
import com.darkwatch.core.model.ProviderType;
import com.darkwatch.core.model.RateLimitConfig;
import com.darkwatch.core.model.RetryConfig;
import com.darkwatch.core.model.Source;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings bound from {@code darkwatch.*}. Invalid values fail startup.
 */
@Component
@ConfigurationProperties(prefix = "darkwatch")
public class DarkwatchProperties {

    /** Interval between registry-wide health checks */
    private Duration healthCheckInterval = Duration.ofMinutes(5);

    /** Upper bound for one connector branch during fan-out */
    private Duration fanOutTimeout = Duration.ofSeconds(90);

    /** Threads running connector calls */
    private int executorThreads = 8;

    /** Threads running background timers */
    private int schedulerThreads = 2;

    private CredentialSettings credentials = new CredentialSettings();
    private AlertSettings alerts = new AlertSettings();
    private Map<String, SourceSettings> sources = new LinkedHashMap<>();
    private VaultSettings vault = new VaultSettings();

    @PostConstruct
    public void validate() {
        requirePositive("darkwatch.health-check-interval", healthCheckInterval);
        requirePositive("darkwatch.fan-out-timeout", fanOutTimeout);
        if (executorThreads < 1 || schedulerThreads < 1) {
            throw new IllegalStateException("darkwatch.executor-threads and darkwatch.scheduler-threads must be at least 1");
        }
        requirePositive("darkwatch.credentials.cache-ttl", credentials.cacheTtl);
        requirePositive("darkwatch.credentials.rotation-interval", credentials.rotationInterval);
        requirePositive("darkwatch.credentials.validation-interval", credentials.validationInterval);
        requirePositive("darkwatch.credentials.verification-ttl", credentials.verificationTtl);
        sources.forEach((id, settings) -> {
            try {
                settings.toSource(id);
            } catch (RuntimeException e) {
                throw new IllegalStateException("Invalid configuration for source '" + id + "': " + e.getMessage(), e);
            }
        });
    }

    public Duration getHealthCheckInterval() { return healthCheckInterval; }
    public void setHealthCheckInterval(Duration healthCheckInterval) { this.healthCheckInterval = healthCheckInterval; }
    public Duration getFanOutTimeout() { return fanOutTimeout; }
    public void setFanOutTimeout(Duration fanOutTimeout) { this.fanOutTimeout = fanOutTimeout; }
    public int getExecutorThreads() { return executorThreads; }
    public void setExecutorThreads(int executorThreads) { this.executorThreads = executorThreads; }
    public int getSchedulerThreads() { return schedulerThreads; }
    public void setSchedulerThreads(int schedulerThreads) { this.schedulerThreads = schedulerThreads; }
    public CredentialSettings getCredentials() { return credentials; }
    public void setCredentials(CredentialSettings credentials) { this.credentials = credentials; }
    public AlertSettings getAlerts() { return alerts; }
    public void setAlerts(AlertSettings alerts) { this.alerts = alerts; }
    public Map<String, SourceSettings> getSources() { return sources; }
    public void setSources(Map<String, SourceSettings> sources) { this.sources = sources; }
    public VaultSettings getVault() { return vault; }
    public void setVault(VaultSettings vault) { this.vault = vault; }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalStateException(name + " must be a positive duration");
        }
    }

    public static class CredentialSettings {
        private Duration cacheTtl = Duration.ofHours(1);
        private Duration validationInterval = Duration.ofHours(1);
        private Duration rotationInterval = Duration.ofHours(24);
        private Duration verificationTtl = Duration.ofMinutes(5);
        private boolean autoRotation = false;

        public Duration getCacheTtl() { return cacheTtl; }
        public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }
        public Duration getValidationInterval() { return validationInterval; }
        public void setValidationInterval(Duration validationInterval) { this.validationInterval = validationInterval; }
        public Duration getRotationInterval() { return rotationInterval; }
        public void setRotationInterval(Duration rotationInterval) { this.rotationInterval = rotationInterval; }
        public Duration getVerificationTtl() { return verificationTtl; }
        public void setVerificationTtl(Duration verificationTtl) { this.verificationTtl = verificationTtl; }
        public boolean isAutoRotation() { return autoRotation; }
        public void setAutoRotation(boolean autoRotation) { this.autoRotation = autoRotation; }
    }

    public static class AlertSettings {
        private double errorRate = 0.1;
        private long responseTimeMs = 5000;
        private int consecutiveFailures = 3;

        public double getErrorRate() { return errorRate; }
        public void setErrorRate(double errorRate) { this.errorRate = errorRate; }
        public long getResponseTimeMs() { return responseTimeMs; }
        public void setResponseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; }
        public int getConsecutiveFailures() { return consecutiveFailures; }
        public void setConsecutiveFailures(int consecutiveFailures) { this.consecutiveFailures = consecutiveFailures; }
    }

    public static class SourceSettings {
        private String name;
        private ProviderType provider;
        private String baseUrl;
        private String credentialRef;
        private boolean enabled = true;
        private Duration timeout = Duration.ofSeconds(30);
        private Duration requestDeadline = Duration.ofMinutes(2);
        private RateLimitSettings rateLimit = new RateLimitSettings();
        private RetrySettings retry = new RetrySettings();

        /**
         * Builds the immutable source description. The credential reference defaults to the source id.
         */
        public Source toSource(String id) {
            if (provider == null) {
                throw new IllegalArgumentException("provider is required");
            }
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new IllegalArgumentException("base-url is required");
            }
            return new Source(
                    id,
                    name,
                    provider,
                    baseUrl,
                    new RateLimitConfig(rateLimit.requestsPerMinute, rateLimit.requestsPerHour,
                            rateLimit.requestsPerDay, rateLimit.burstCapacity),
                    new RetryConfig(retry.maxRetries, retry.baseDelay, retry.maxDelay,
                            retry.backoffMultiplier, retry.jitterFactor),
                    credentialRef == null || credentialRef.isBlank() ? id : credentialRef,
                    timeout,
                    requestDeadline,
                    enabled);
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public ProviderType getProvider() { return provider; }
        public void setProvider(ProviderType provider) { this.provider = provider; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getCredentialRef() { return credentialRef; }
        public void setCredentialRef(String credentialRef) { this.credentialRef = credentialRef; }
        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public Duration getRequestDeadline() { return requestDeadline; }
        public void setRequestDeadline(Duration requestDeadline) { this.requestDeadline = requestDeadline; }
        public RateLimitSettings getRateLimit() { return rateLimit; }
        public void setRateLimit(RateLimitSettings rateLimit) { this.rateLimit = rateLimit; }
        public RetrySettings getRetry() { return retry; }
        public void setRetry(RetrySettings retry) { this.retry = retry; }
    }

    public static class RateLimitSettings {
        private int requestsPerMinute = 60;
        private int requestsPerHour = 0;
        private int requestsPerDay = 0;
        private int burstCapacity = 10;

        public int getRequestsPerMinute() { return requestsPerMinute; }
        public void setRequestsPerMinute(int requestsPerMinute) { this.requestsPerMinute = requestsPerMinute; }
        public int getRequestsPerHour() { return requestsPerHour; }
        public void setRequestsPerHour(int requestsPerHour) { this.requestsPerHour = requestsPerHour; }
        public int getRequestsPerDay() { return requestsPerDay; }
        public void setRequestsPerDay(int requestsPerDay) { this.requestsPerDay = requestsPerDay; }
        public int getBurstCapacity() { return burstCapacity; }
        public void setBurstCapacity(int burstCapacity) { this.burstCapacity = burstCapacity; }
    }

    public static class RetrySettings {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.0;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Duration getBaseDelay() { return baseDelay; }
        public void setBaseDelay(Duration baseDelay) { this.baseDelay = baseDelay; }
        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
        public double getJitterFactor() { return jitterFactor; }
        public void setJitterFactor(double jitterFactor) { this.jitterFactor = jitterFactor; }
    }

    /**
     * Secrets for the configuration-seeded vault. Values normally come from environment variables.
     */
    public static class VaultSettings {
        private Map<String, SecretSettings> secrets = new LinkedHashMap<>();

        public Map<String, Credentials> toCredentials() {
            var result = new LinkedHashMap<String, Credentials>();
            secrets.forEach((id, s) -> {
                if (s.apiKey != null && !s.apiKey.isBlank()) {
                    result.put(id, new Credentials(s.apiKey, blankToNull(s.secret), blankToNull(s.token), s.headers, null));
                }
            });
            return result;
        }

        public Map<String, SecretSettings> getSecrets() { return secrets; }
        public void setSecrets(Map<String, SecretSettings> secrets) { this.secrets = secrets; }

        private static String blankToNull(String value) {
            return value == null || value.isBlank() ? null : value;
        }
    }

    public static class SecretSettings {
        private String apiKey;
        private String secret;
        private String token;
        private Map<String, String> headers = new LinkedHashMap<>();

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getSecret() { return secret; }
        public void setSecret(String secret) { this.secret = secret; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public Map<String, String> getHeaders() { return headers; }
        public void setHeaders(Map<String, String> headers) { this.headers = headers; }
    }
}
