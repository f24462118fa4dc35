package com.darkwatch.core.connector;

import com.darkwatch.core.model.BreachQuery;
import com.darkwatch.core.model.BreachResult;
import com.darkwatch.core.model.CredentialQuery;
import com.darkwatch.core.model.CredentialResult;
import com.darkwatch.core.model.Credentials;
import com.darkwatch.core.model.HealthStatus;
import com.darkwatch.core.model.KeywordMonitorResult;
import com.darkwatch.core.model.MarketplaceQuery;
import com.darkwatch.core.model.MarketplaceResult;
import com.darkwatch.core.model.Source;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Uniform capability of one external threat intelligence provider.
 * <p>
 * Searches complete with an empty list when nothing is found and fail only with
 * {@link ConnectorException}. A connector that does not support a category answers it with
 * an empty list.
 */
public interface ThreatIntelConnector {

    Source source();

    default String sourceId() {
        return source().id();
    }

    /**
     * Fetches credentials and runs one health check. Fails with {@code INIT_FAILED} only when
     * credentials cannot be obtained; an unhealthy provider still initializes.
     */
    CompletableFuture<Void> initialize();

    CompletableFuture<List<CredentialResult>> searchCredentials(CredentialQuery query);

    CompletableFuture<List<MarketplaceResult>> searchMarketplaces(MarketplaceQuery query);

    CompletableFuture<List<BreachResult>> searchBreachDatabases(BreachQuery query);

    /**
     * One aggregate of keyword hits from this source. A source without keyword monitoring
     * answers with an aggregate holding no matches.
     */
    CompletableFuture<KeywordMonitorResult> monitorKeywords(List<String> keywords);

    /**
     * Probes the provider and updates health. The future never fails.
     */
    CompletableFuture<HealthStatus> performHealthCheck();

    HealthStatus sourceHealth();

    /**
     * Live check of the given credentials against the provider, under the source's rate limit.
     * Used by the credential verifier; does not change connector health.
     */
    boolean verifyCredentials(Credentials credentials) throws Exception;

    default void close() {
    }
}
