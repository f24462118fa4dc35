package com.darkwatch.core.connector.constella;

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
import com.darkwatch.core.model.DateRange;
import com.darkwatch.core.model.HealthStatus;
import com.darkwatch.core.model.KeywordMatch;
import com.darkwatch.core.model.KeywordMonitorResult;
import com.darkwatch.core.model.MarketplaceQuery;
import com.darkwatch.core.model.MarketplaceResult;
import com.darkwatch.core.model.Source;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Constella Intelligence: credential exposure and leaked API key monitoring.
 * <p>
 * Credentials are searched once per term group (emails, domains, usernames, key hashes), then
 * deduplicated by email and breach name and filtered by confidence. Constella has no
 * marketplace data.
 */
public class ConstellaConnector implements ThreatIntelConnector {

    private static final Logger log = LoggerFactory.getLogger(ConstellaConnector.class);

    static final double DEFAULT_MIN_CONFIDENCE = 0.7;
    static final int PAGE_LIMIT = 1000;
    static final int KEYWORD_MAX_RESULTS = 100;

    private final ConnectorRuntime runtime;

    public ConstellaConnector(ConnectorRuntime runtime) {
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
        return runtime.submit("searchCredentials", () -> {
            var results = new ArrayList<CredentialResult>();
            if (!query.emails().isEmpty()) {
                results.addAll(searchCredentialGroup("emails", query.emails(), query));
            }
            if (!query.domains().isEmpty()) {
                results.addAll(searchCredentialGroup("domains", query.domains(), query));
            }
            if (!query.usernames().isEmpty()) {
                results.addAll(searchCredentialGroup("usernames", query.usernames(), query));
            }
            if (!query.apiKeyHashes().isEmpty()) {
                results.addAll(searchApiKeyHashes(query));
            }
            double minConfidence = query.minConfidence() != null ? query.minConfidence() : DEFAULT_MIN_CONFIDENCE;
            var filtered = dedupByEmailAndBreach(results).stream()
                    .filter(r -> r.confidence() >= minConfidence)
                    .toList();
            log.debug("Constella returned {} credential results ({} after filtering)", results.size(), filtered.size());
            return filtered;
        });
    }

    @Override
    public CompletableFuture<List<MarketplaceResult>> searchMarketplaces(MarketplaceQuery query) {
        return CompletableFuture.completedFuture(List.of());
    }

    @Override
    public CompletableFuture<List<BreachResult>> searchBreachDatabases(BreachQuery query) {
        return runtime.submit("searchBreachDatabases", () -> {
            var results = new ArrayList<BreachResult>();
            if (!query.emails().isEmpty()) {
                results.addAll(searchBreachGroup("emails", query.emails(), query));
            }
            if (!query.domains().isEmpty()) {
                results.addAll(searchBreachGroup("domains", query.domains(), query));
            }
            if (query.breachNames().isEmpty()) {
                return List.copyOf(results);
            }
            var wanted = query.breachNames().stream().map(n -> n.toLowerCase(Locale.ROOT)).toList();
            return results.stream()
                    .filter(r -> r.breachName() != null
                            && wanted.stream().anyMatch(r.breachName().toLowerCase(Locale.ROOT)::contains))
                    .toList();
        });
    }

    @Override
    public CompletableFuture<KeywordMonitorResult> monitorKeywords(List<String> keywords) {
        return runtime.submit("monitorKeywords", () -> {
            var body = new LinkedHashMap<String, Object>();
            body.put("keywords", keywords);
            body.put("include_context", true);
            body.put("max_results", KEYWORD_MAX_RESULTS);
            JsonNode response = runtime.execute("monitorKeywords",
                    creds -> http().postJson(url("/monitor/keywords"), body, headers(creds), source().timeout()));

            Instant now = runtime.clock().instant();
            var matches = new ArrayList<KeywordMatch>();
            for (JsonNode match : JsonFields.array(response, "matches")) {
                Instant discovered = JsonFields.instant(match, "discovered_date");
                String content = JsonFields.text(match, "content");
                String context = JsonFields.text(match, "context", "");
                matches.add(new KeywordMatch(
                        JsonFields.text(match, "id"),
                        content,
                        JsonFields.text(match, "source_url", ""),
                        JsonFields.text(match, "title"),
                        discovered,
                        RiskScoring.keywordScore(content, context, discovered, now),
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

    private boolean probe(Credentials credentials) throws Exception {
        JsonNode response = http().get(url("/health"), headers(credentials), source().timeout());
        return "healthy".equals(JsonFields.text(response, "status"));
    }

    private List<CredentialResult> searchCredentialGroup(String field, List<String> terms, CredentialQuery query) {
        var body = rangeBody(query.timeRange());
        body.put(field, terms);
        body.put("include_passwords", query.includePasswords());
        JsonNode response = runtime.execute("searchCredentials",
                creds -> http().postJson(url("/credentials/search"), body, headers(creds), source().timeout()));
        Instant now = runtime.clock().instant();
        return JsonFields.array(response, "results").stream()
                .map(node -> mapCredential(node, query.includePasswords(), now))
                .toList();
    }

    private List<CredentialResult> searchApiKeyHashes(CredentialQuery query) {
        var body = rangeBody(query.timeRange());
        body.put("key_hashes", query.apiKeyHashes());
        JsonNode response = runtime.execute("searchApiKeys",
                creds -> http().postJson(url("/apikeys/search"), body, headers(creds), source().timeout()));
        return JsonFields.array(response, "results").stream()
                .map(this::mapApiKey)
                .toList();
    }

    private List<BreachResult> searchBreachGroup(String field, List<String> terms, BreachQuery query) {
        var body = rangeBody(query.timeRange());
        body.put(field, terms);
        body.put("include_passwords", query.includePasswords());
        body.put("verified_only", query.verifiedOnly());
        JsonNode response = runtime.execute("searchBreachDatabases",
                creds -> http().postJson(url("/breaches/search"), body, headers(creds), source().timeout()));
        Instant now = runtime.clock().instant();
        return JsonFields.array(response, "results").stream()
                .map(node -> mapBreach(node, now))
                .toList();
    }

    CredentialResult mapCredential(JsonNode node, boolean includePasswords, Instant now) {
        String plain = includePasswords ? JsonFields.text(node, "password_plain") : null;
        double confidence = JsonFields.number(node, "confidence_score", 0.0);
        double reliability = JsonFields.number(node, "source_reliability", 0.0);
        Instant breachDate = JsonFields.instant(node, "breach_date");

        var metadata = new HashMap<String, Object>();
        metadata.put("sourceReliability", reliability);
        metadata.put("additionalData", JsonFields.object(node, "additional_data"));

        return new CredentialResult(
                JsonFields.text(node, "id"),
                source().id(),
                JsonFields.text(node, "email"),
                JsonFields.text(node, "username"),
                JsonFields.text(node, "domain"),
                JsonFields.text(node, "password_hash"),
                plain,
                JsonFields.text(node, "breach_name"),
                breachDate,
                JsonFields.instant(node, "discovered_date"),
                confidence,
                RiskScoring.credentialScore(plain != null && !plain.isEmpty(), confidence, breachDate, reliability, now),
                metadata);
    }

    CredentialResult mapApiKey(JsonNode node) {
        String service = JsonFields.text(node, "service_name", "unknown");
        String riskLevel = JsonFields.text(node, "risk_level", "");
        Instant discovered = JsonFields.instant(node, "discovered_date");

        var metadata = new HashMap<String, Object>();
        metadata.put("exposureContext", JsonFields.text(node, "exposure_context"));
        metadata.put("lastSeen", JsonFields.text(node, "last_seen"));
        metadata.put("serviceName", service);

        return new CredentialResult(
                JsonFields.text(node, "id"),
                source().id(),
                "",
                service,
                JsonFields.text(node, "domain"),
                JsonFields.text(node, "api_key_hash"),
                null,
                "API Key Exposure - " + service,
                discovered,
                discovered,
                RiskScoring.riskLevelConfidence(riskLevel),
                RiskScoring.riskLevelScore(riskLevel),
                metadata);
    }

    BreachResult mapBreach(JsonNode node, Instant now) {
        boolean verified = JsonFields.bool(node, "verified");
        long records = JsonFields.integer(node, "affected_records", 0);
        var dataTypes = JsonFields.strings(node, "data_types");
        Instant breachDate = JsonFields.instant(node, "breach_date");
        var emails = JsonFields.strings(node, "affected_emails");

        var metadata = new HashMap<String, Object>();
        metadata.put("sourceReliability", JsonFields.number(node, "source_reliability", 0.0));
        metadata.put("additionalInfo", JsonFields.object(node, "additional_info"));

        return new BreachResult(
                JsonFields.text(node, "id"),
                source().id(),
                JsonFields.text(node, "breach_name"),
                breachDate,
                JsonFields.instant(node, "discovered_date"),
                records,
                dataTypes,
                JsonFields.text(node, "description", ""),
                verified,
                RiskScoring.breachScore(verified, breachDate, records, dataTypes, now),
                emails,
                domainsOf(emails, JsonFields.strings(node, "affected_domains")),
                metadata);
    }

    private static List<String> domainsOf(List<String> emails, List<String> explicit) {
        Set<String> domains = new LinkedHashSet<>(explicit);
        for (String email : emails) {
            int at = email.lastIndexOf('@');
            if (at >= 0 && at < email.length() - 1) {
                domains.add(email.substring(at + 1).toLowerCase(Locale.ROOT));
            }
        }
        return List.copyOf(domains);
    }

    private static List<CredentialResult> dedupByEmailAndBreach(List<CredentialResult> results) {
        var seen = new LinkedHashMap<String, CredentialResult>();
        for (var result : results) {
            seen.putIfAbsent(result.email() + "-" + result.breachName(), result);
        }
        return List.copyOf(seen.values());
    }

    private Map<String, Object> rangeBody(DateRange range) {
        var body = new LinkedHashMap<String, Object>();
        body.put("date_from", range.start().toString());
        body.put("date_to", range.end().toString());
        body.put("limit", PAGE_LIMIT);
        return body;
    }

    private Map<String, String> headers(Credentials credentials) {
        var headers = new LinkedHashMap<String, String>(credentials.additionalHeaders());
        headers.put("Authorization", ProviderHttpClient.bearer(credentials.apiKey()));
        headers.put("User-Agent", "Darkwatch/0.1");
        return headers;
    }

    private String url(String path) {
        return source().baseUrl() + "/v1" + path;
    }

    private ProviderHttpClient http() {
        return runtime.http();
    }
}
