package com.darkwatch.core.connector.intsights;

import com.darkwatch.core.connector.ConnectorRuntime;
import com.darkwatch.core.connector.JsonFields;
import com.darkwatch.core.connector.ProviderHttpClient;
import com.darkwatch.core.connector.RiskScoring;
import com.darkwatch.core.connector.ThreatIntelConnector;
import com.darkwatch.core.model.BreachQuery;
import com.darkwatch.core.model.BreachResult;
import com.darkwatch.core.model.CredentialQuery;
import com.darkwatch.core.model.CredentialResult;
import com.darkwatch.core.model.Credentials;
import com.darkwatch.core.model.HealthStatus;
import com.darkwatch.core.model.KeywordMatch;
import com.darkwatch.core.model.KeywordMonitorResult;
import com.darkwatch.core.model.MarketplaceQuery;
import com.darkwatch.core.model.MarketplaceResult;
import com.darkwatch.core.model.Source;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * IntSights: dark web marketplace listings and keyword alerts.
 * <p>
 * Marketplace search pages through results until the provider reports no further pages or
 * {@link #MAX_PAGES} is reached. Credential and breach searches are not offered.
 */
public class IntSightsConnector implements ThreatIntelConnector {

    private static final Logger log = LoggerFactory.getLogger(IntSightsConnector.class);

    static final int PAGE_SIZE = 100;
    static final int MAX_PAGES = 10;

    private final ConnectorRuntime runtime;

    public IntSightsConnector(ConnectorRuntime runtime) {
        this.runtime = runtime;
    }

    @Override
    public Source source() {
        return runtime.source();
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return runtime.initialize(this::probe);
    }

    @Override
    public CompletableFuture<List<CredentialResult>> searchCredentials(CredentialQuery query) {
        return CompletableFuture.completedFuture(List.of());
    }

    @Override
    public CompletableFuture<List<MarketplaceResult>> searchMarketplaces(MarketplaceQuery query) {
        return runtime.submit("searchMarketplaces", () -> {
            var results = new ArrayList<MarketplaceResult>();
            for (int page = 1; page <= MAX_PAGES; page++) {
                var body = new LinkedHashMap<String, Object>();
                body.put("keywords", query.keywords());
                body.put("domains", query.domains());
                body.put("categories", query.categories());
                body.put("date_from", query.timeRange().start().toString());
                body.put("date_to", query.timeRange().end().toString());
                body.put("page", page);
                body.put("page_size", PAGE_SIZE);

                JsonNode response = runtime.execute("searchMarketplaces",
                        creds -> http().postJson(url("/marketplace/search"), body, headers(creds), source().timeout()));
                var listings = JsonFields.array(response, "results");
                for (JsonNode listing : listings) {
                    results.add(mapListing(listing, query.includeMetadata()));
                }
                if (listings.isEmpty() || !JsonFields.bool(response, "has_more")) {
                    break;
                }
                if (page == MAX_PAGES) {
                    log.warn("IntSights marketplace search for {} truncated after {} pages", source().id(), MAX_PAGES);
                }
            }
            if (query.minRiskScore() == null) {
                return List.copyOf(results);
            }
            int minRisk = query.minRiskScore();
            return results.stream().filter(r -> r.riskScore() >= minRisk).toList();
        });
    }

    @Override
    public CompletableFuture<List<BreachResult>> searchBreachDatabases(BreachQuery query) {
        return CompletableFuture.completedFuture(List.of());
    }

    @Override
    public CompletableFuture<KeywordMonitorResult> monitorKeywords(List<String> keywords) {
        return runtime.submit("monitorKeywords", () -> {
            var body = Map.<String, Object>of("keywords", keywords, "include_context", true);
            JsonNode response = runtime.execute("monitorKeywords",
                    creds -> http().postJson(url("/keywords/matches"), body, headers(creds), source().timeout()));
            Instant now = runtime.clock().instant();
            var matches = new ArrayList<KeywordMatch>();
            for (JsonNode match : JsonFields.array(response, "matches")) {
                Instant found = JsonFields.instant(match, "found_date");
                String content = JsonFields.text(match, "snippet");
                String context = JsonFields.text(match, "context", "");
                matches.add(new KeywordMatch(
                        JsonFields.text(match, "id"),
                        content,
                        JsonFields.text(match, "url", ""),
                        JsonFields.text(match, "title"),
                        found,
                        RiskScoring.keywordScore(content, context, found, now),
                        context));
            }
            return new KeywordMonitorResult(
                    source().id() + "-monitor-" + now.toEpochMilli(),
                    keywords,
                    source().id(),
                    matches,
                    JsonFields.integer(response, "total", matches.size()),
                    now);
        });
    }

    @Override
    public CompletableFuture<HealthStatus> performHealthCheck() {
        return runtime.healthCheck(this::probe);
    }

    @Override
    public HealthStatus sourceHealth() {
        return runtime.health();
    }

    @Override
    public boolean verifyCredentials(Credentials credentials) throws Exception {
        return runtime.verify(credentials, this::probe);
    }

    // Any 2xx from the credential test endpoint counts as healthy.
    private boolean probe(Credentials credentials) throws Exception {
        http().get(url("/test-credentials"), headers(credentials), source().timeout());
        return true;
    }

    MarketplaceResult mapListing(JsonNode node, boolean includeMetadata) {
        int risk = node.hasNonNull("risk_score")
                ? RiskScoring.clamp((int) JsonFields.integer(node, "risk_score", 0))
                : RiskScoring.riskLevelScore(JsonFields.text(node, "severity"));
        String price = JsonFields.text(node, "price");
        Map<String, Object> metadata = includeMetadata ? JsonFields.object(node, "metadata") : Map.of();

        return new MarketplaceResult(
                JsonFields.text(node, "id"),
                source().id(),
                JsonFields.text(node, "title"),
                JsonFields.text(node, "description", ""),
                JsonFields.text(node, "url"),
                JsonFields.text(node, "marketplace"),
                JsonFields.text(node, "category"),
                parsePrice(price),
                JsonFields.text(node, "currency"),
                JsonFields.text(node, "seller"),
                JsonFields.instant(node, "discovered_date"),
                JsonFields.instant(node, "last_seen"),
                risk,
                JsonFields.strings(node, "keywords"),
                metadata);
    }

    private static BigDecimal parsePrice(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring unparseable listing price '{}'", raw);
            return null;
        }
    }

    private Map<String, String> headers(Credentials credentials) {
        var headers = new LinkedHashMap<String, String>(credentials.additionalHeaders());
        headers.put("Authorization", ProviderHttpClient.basic(credentials.apiKey(), credentials.secret()));
        return headers;
    }

    private String url(String path) {
        return source().baseUrl() + "/public/v1" + path;
    }

    private ProviderHttpClient http() {
        return runtime.http();
    }
}
