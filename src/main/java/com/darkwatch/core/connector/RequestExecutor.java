package com.darkwatch.core.connector;

import com.darkwatch.core.credentials.CredentialInvalidException;
import com.darkwatch.core.credentials.CredentialRotationException;
import com.darkwatch.core.credentials.VaultException;
import com.darkwatch.core.logging.MdcContext;
import com.darkwatch.core.metrics.DarkwatchMetrics;
import com.darkwatch.core.model.Credentials;
import com.darkwatch.core.model.HealthStatus;
import com.darkwatch.core.model.Source;
import com.darkwatch.core.ratelimit.RateLimiter;
import com.darkwatch.core.ratelimit.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Runs every provider call of one connector through the same pipeline: credentials,
 * rate-limiter token, attempt, classification, backoff, health bookkeeping.
 * <p>
 * A token is taken for every attempt, retries included. Rate-limited retries consume the same
 * {@code maxRetries} budget as transient ones. No attempt starts, and neither a rate-limit wait
 * nor a backoff sleep extends past the source's request deadline.
 */
public class RequestExecutor {

    private static final Logger log = LoggerFactory.getLogger(RequestExecutor.class);

    private final Source source;
    private final RateLimiter rateLimiter;
    private final CredentialHandle credentials;
    private final HealthTracker health;
    private final BackoffPolicy backoff;
    private final ErrorClassifier classifier;
    private final Sleeper sleeper;
    private final Clock clock;
    private final DarkwatchMetrics metrics;

    public RequestExecutor(Source source, RateLimiter rateLimiter, CredentialHandle credentials,
                           HealthTracker health, BackoffPolicy backoff, ErrorClassifier classifier,
                           Sleeper sleeper, Clock clock, DarkwatchMetrics metrics) {
        this.source = source;
        this.rateLimiter = rateLimiter;
        this.credentials = credentials;
        this.health = health;
        this.backoff = backoff;
        this.classifier = classifier;
        this.sleeper = sleeper;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Executes {@code call} with retries.
     *
     * @throws ConnectorException once the call fails fatally, retries are exhausted,
     *                            the deadline passes or the thread is interrupted
     */
    public <T> T execute(String operation, ProviderCall<T> call) {
        MdcContext.setOperation(source.id(), operation);
        Instant deadline = clock.instant().plus(source.requestDeadline());
        long requestStart = clock.millis();
        int attempts = 0;
        try {
            while (true) {
                if (!clock.instant().isBefore(deadline)) {
                    throw terminal(operation, requestStart, ConnectorException.DEADLINE_EXCEEDED,
                            "Request deadline of " + source.requestDeadline() + " exceeded",
                            true, false, attempts, null, -1);
                }

                Credentials current = currentCredentials(operation, requestStart, attempts);
                acquireToken(operation, requestStart, attempts, deadline);
                attempts++;

                long attemptStart = clock.millis();
                try {
                    T result = call.call(current);
                    long elapsed = clock.millis() - attemptStart;
                    health.recordSuccess(elapsed);
                    recordRequest(operation, "success", requestStart);
                    if (attempts > 1) {
                        log.info("{} on {} succeeded after {} attempts", operation, source.id(), attempts);
                    }
                    return result;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw terminal(operation, requestStart, ConnectorException.INTERRUPTED,
                            "Interrupted during " + operation, false, false, attempts, e, -1);
                } catch (Exception e) {
                    long elapsed = clock.millis() - attemptStart;
                    var classification = classifier.classify(e);

                    if (classification.kind() == ErrorKind.AUTHENTICATION) {
                        credentials.invalidate();
                    }
                    if (!classification.retryable() || attempts > backoff.maxRetries()) {
                        throw terminal(operation, requestStart, classification.errorCode(),
                                describe(operation, e, attempts), classification.retryable(),
                                classification.rateLimited(), attempts, e, elapsed);
                    }

                    Duration delay = backoff.delayFor(attempts - 1);
                    Duration remaining = Duration.between(clock.instant(), deadline);
                    if (delay.compareTo(remaining) >= 0) {
                        throw terminal(operation, requestStart, ConnectorException.DEADLINE_EXCEEDED,
                                "Backoff of " + delay.toMillis() + "ms would exceed the request deadline",
                                true, classification.rateLimited(), attempts, e, elapsed);
                    }

                    if (metrics != null) {
                        metrics.recordRetry(source.id(), classification.rateLimited());
                    }
                    log.warn("{} on {} failed with {} (attempt {}/{}), retrying in {}ms",
                            operation, source.id(), classification.errorCode(), attempts,
                            backoff.maxRetries() + 1, delay.toMillis());
                    sleep(operation, requestStart, attempts, delay);
                }
            }
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Runs a liveness probe under the same rate limiter and records its outcome. Never throws.
     */
    public HealthStatus probe(ProviderCall<Boolean> probe) {
        MdcContext.setOperation(source.id(), "healthCheck");
        long start = clock.millis();
        try {
            var current = credentials.get();
            if (!rateLimiter.tryAcquire(source.requestDeadline())) {
                log.debug("Health check for {} skipped, rate limit wait {} exceeds the request deadline",
                        source.id(), rateLimiter.waitTime());
                return health.snapshot();
            }
            start = clock.millis();
            boolean ok = Boolean.TRUE.equals(probe.call(current));
            long elapsed = clock.millis() - start;
            if (ok) {
                health.recordSuccess(elapsed);
            } else {
                health.recordFailure("Health check reported the source as unhealthy", elapsed);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            health.recordFailure("Health check interrupted", -1);
        } catch (Exception e) {
            long elapsed = clock.millis() - start;
            if (classifier.classify(e).kind() == ErrorKind.AUTHENTICATION) {
                credentials.invalidate();
            }
            log.warn("Health check for {} failed: {}", source.id(), e.getMessage());
            health.recordFailure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), elapsed);
        } finally {
            MdcContext.clear();
        }
        var status = health.snapshot();
        if (metrics != null) {
            metrics.recordHealthCheck(source.id(), status.healthy());
        }
        return status;
    }

    private Credentials currentCredentials(String operation, long requestStart, int attempts) {
        try {
            return credentials.get();
        } catch (CredentialInvalidException | CredentialRotationException e) {
            throw terminal(operation, requestStart, ConnectorException.CREDENTIALS_UNAVAILABLE,
                    e.getMessage(), false, false, attempts, e, -1);
        } catch (VaultException e) {
            throw terminal(operation, requestStart, ConnectorException.CREDENTIALS_UNAVAILABLE,
                    e.getMessage(), e.isRetryable(), false, attempts, e, -1);
        }
    }

    private void acquireToken(String operation, long requestStart, int attempts, Instant deadline) {
        long before = clock.millis();
        try {
            if (!rateLimiter.tryAcquire(Duration.between(clock.instant(), deadline))) {
                throw terminal(operation, requestStart, ConnectorException.DEADLINE_EXCEEDED,
                        "Rate limit wait of " + rateLimiter.waitTime().toMillis()
                                + "ms would exceed the request deadline",
                        true, true, attempts, null, -1);
            }
            long waited = clock.millis() - before;
            if (metrics != null && waited > 0) {
                metrics.recordRateLimiterWait(source.id(), Duration.ofMillis(waited));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw terminal(operation, requestStart, ConnectorException.INTERRUPTED,
                    "Interrupted while waiting for a rate limit token", false, false, attempts, e, -1);
        }
    }

    private void sleep(String operation, long requestStart, int attempts, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw terminal(operation, requestStart, ConnectorException.INTERRUPTED,
                    "Interrupted during backoff", false, false, attempts, e, -1);
        }
    }

    private ConnectorException terminal(String operation, long requestStart, String errorCode, String message,
                                        boolean retryable, boolean rateLimited, int attempts,
                                        Throwable cause, long responseTimeMs) {
        health.recordFailure(message, responseTimeMs);
        recordRequest(operation, errorCode, requestStart);
        log.error("{} on {} failed: {} ({}, attempts={})", operation, source.id(), message, errorCode, attempts);
        return new ConnectorException(message, source.id(), errorCode, retryable, rateLimited, attempts, cause);
    }

    private void recordRequest(String operation, String outcome, long requestStart) {
        if (metrics != null) {
            metrics.recordRequest(source.id(), operation, outcome, clock.millis() - requestStart);
        }
    }

    private String describe(String operation, Exception e, int attempts) {
        return operation + " failed after " + attempts + " attempt" + (attempts == 1 ? "" : "s")
                + ": " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }
}
