package com.darkwatch.core.connector;

import com.darkwatch.core.credentials.CredentialStore;
import com.darkwatch.core.metrics.DarkwatchMetrics;
import com.darkwatch.core.model.Credentials;
import com.darkwatch.core.model.HealthStatus;
import com.darkwatch.core.model.Source;
import com.darkwatch.core.ratelimit.RateLimiter;
import com.darkwatch.core.ratelimit.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Per-connector plumbing shared by every vendor implementation: the limiter, credential
 * handle, health tracker and request pipeline for one {@link Source}, plus the executor that
 * runs its calls off the caller's thread.
 */
public class ConnectorRuntime {

    private static final Logger log = LoggerFactory.getLogger(ConnectorRuntime.class);

    private final Source source;
    private final ProviderHttpClient http;
    private final Executor executor;
    private final Clock clock;
    private final RateLimiter rateLimiter;
    private final CredentialHandle credentials;
    private final HealthTracker health;
    private final RequestExecutor requests;

    public ConnectorRuntime(Source source, CredentialStore credentialStore, ProviderHttpClient http,
                            Executor executor, Clock clock, Sleeper sleeper, DarkwatchMetrics metrics) {
        this(source, credentialStore, http, executor, clock, sleeper, metrics, ErrorClassifier.DEFAULT);
    }

    public ConnectorRuntime(Source source, CredentialStore credentialStore, ProviderHttpClient http,
                            Executor executor, Clock clock, Sleeper sleeper, DarkwatchMetrics metrics,
                            ErrorClassifier classifier) {
        this.source = source;
        this.http = http;
        this.executor = executor;
        this.clock = clock;
        this.rateLimiter = new RateLimiter(source.rateLimits(), clock, sleeper);
        this.credentials = new CredentialHandle(credentialStore, source.credentialRef(), clock);
        this.health = new HealthTracker(source.id(), clock);
        this.requests = new RequestExecutor(source, rateLimiter, credentials, health,
                new BackoffPolicy(source.retry()), classifier, sleeper, clock, metrics);
    }

    public Source source() {
        return source;
    }

    public ProviderHttpClient http() {
        return http;
    }

    public Clock clock() {
        return clock;
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public HealthStatus health() {
        return health.snapshot();
    }

    public <T> T execute(String operation, ProviderCall<T> call) {
        return requests.execute(operation, call);
    }

    /**
     * Runs {@code work} on the connector executor. Anything other than a
     * {@link ConnectorException} escaping it is wrapped into one.
     */
    public <T> CompletableFuture<T> submit(String operation, Supplier<T> work) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return work.get();
            } catch (ConnectorException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ConnectorException(operation + " failed: " + e.getMessage(), source.id(),
                        "UNKNOWN_ERROR", true, false, 0, e);
            }
        }, executor);
    }

    /**
     * Runs {@code probe} with caller-supplied credentials after taking a rate-limit token.
     * Health is left untouched.
     *
     * @throws ConnectorException when no token frees up within the request deadline
     */
    public boolean verify(Credentials candidate, ProviderCall<Boolean> probe) throws Exception {
        if (!rateLimiter.tryAcquire(source.requestDeadline())) {
            throw new ConnectorException("Rate limit wait would exceed the request deadline", source.id(),
                    ConnectorException.DEADLINE_EXCEEDED, true, true, 0, null);
        }
        return Boolean.TRUE.equals(probe.call(candidate));
    }

    public CompletableFuture<Void> initialize(ProviderCall<Boolean> probe) {
        return CompletableFuture.runAsync(() -> {
            try {
                credentials.get();
            } catch (RuntimeException e) {
                log.error("Failed to initialize connector {}: {}", source.id(), e.getMessage());
                health.recordFailure(e.getMessage(), -1);
                throw new CompletionException(new ConnectorException(
                        "Failed to initialize connector " + source.id() + ": " + e.getMessage(),
                        source.id(), ConnectorException.INIT_FAILED, false, false, 0, e));
            }
            var status = requests.probe(probe);
            if (status.healthy()) {
                log.info("Connector {} initialized ({}ms)", source.id(), status.responseTimeMs());
            } else {
                log.warn("Connector {} initialized but unhealthy: {}", source.id(), status.lastError());
            }
        }, executor);
    }

    public CompletableFuture<HealthStatus> healthCheck(ProviderCall<Boolean> probe) {
        return CompletableFuture.supplyAsync(() -> requests.probe(probe), executor)
                .exceptionally(e -> {
                    health.recordFailure(e.getMessage(), -1);
                    return health.snapshot();
                });
    }
}
