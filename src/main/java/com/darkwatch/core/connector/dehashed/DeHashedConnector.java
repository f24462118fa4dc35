package com.darkwatch.core.connector.dehashed;

import com.darkwatch.core.connector.ConnectorRuntime;
import com.darkwatch.core.connector.JsonFields;
import com.darkwatch.core.connector.ProviderHttpClient;
import com.darkwatch.core.connector.ProviderRateLimitException;
import com.darkwatch.core.connector.RiskScoring;
import com.darkwatch.core.connector.ThreatIntelConnector;
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
 * DeHashed breach repository. One lucene-style query per request; entries are mapped to
 * credentials directly and grouped by database name for breach results.
 * <p>
 * A response reporting {@code balance == 0} means the account's query allowance is spent and
 * is treated as a rate-limit signal.
 */
public class DeHashedConnector implements ThreatIntelConnector {

    private static final Logger log = LoggerFactory.getLogger(DeHashedConnector.class);

    static final int PAGE_SIZE = 1000;
    static final double ENTRY_CONFIDENCE = 0.8;

    private static final Map<String, String> DATA_TYPE_FIELDS = Map.of(
            "email", "email",
            "username", "username",
            "password", "password",
            "hashed_password", "hashed_password",
            "ip_address", "ip_address",
            "phone", "phone",
            "address", "address",
            "name", "name");

    private final ConnectorRuntime runtime;

    public DeHashedConnector(ConnectorRuntime runtime) {
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
            var terms = new ArrayList<String>();
            query.emails().forEach(e -> terms.add("email:\"" + e + "\""));
            query.domains().forEach(d -> terms.add("domain:" + d));
            query.usernames().forEach(u -> terms.add("username:\"" + u + "\""));
            if (terms.isEmpty()) {
                return List.<CredentialResult>of();
            }
            Instant now = runtime.clock().instant();
            var results = search("searchCredentials", String.join(" OR ", terms)).stream()
                    .map(entry -> mapCredential(entry, query.includePasswords(), now))
                    .toList();
            if (query.minConfidence() == null) {
                return results;
            }
            double min = query.minConfidence();
            return results.stream().filter(r -> r.confidence() >= min).toList();
        });
    }

    @Override
    public CompletableFuture<List<MarketplaceResult>> searchMarketplaces(MarketplaceQuery query) {
        return CompletableFuture.completedFuture(List.of());
    }

    @Override
    public CompletableFuture<List<BreachResult>> searchBreachDatabases(BreachQuery query) {
        return runtime.submit("searchBreachDatabases", () -> {
            var terms = new ArrayList<String>();
            query.emails().forEach(e -> terms.add("email:\"" + e + "\""));
            query.domains().forEach(d -> terms.add("domain:" + d));
            if (terms.isEmpty()) {
                return List.<BreachResult>of();
            }
            var grouped = new LinkedHashMap<String, List<JsonNode>>();
            for (JsonNode entry : search("searchBreachDatabases", String.join(" OR ", terms))) {
                grouped.computeIfAbsent(JsonFields.text(entry, "database_name", "Unknown"), k -> new ArrayList<>())
                        .add(entry);
            }
            Instant now = runtime.clock().instant();
            var wanted = query.breachNames().stream().map(n -> n.toLowerCase(Locale.ROOT)).toList();
            var results = new ArrayList<BreachResult>();
            grouped.forEach((database, entries) -> {
                if (!wanted.isEmpty()
                        && wanted.stream().noneMatch(database.toLowerCase(Locale.ROOT)::contains)) {
                    return;
                }
                results.add(toBreach(database, entries, query.includePasswords(), now));
            });
            return List.copyOf(results);
        });
    }

    @Override
    public CompletableFuture<KeywordMonitorResult> monitorKeywords(List<String> keywords) {
        Instant now = runtime.clock().instant();
        return CompletableFuture.completedFuture(new KeywordMonitorResult(
                source().id() + "-monitor-" + now.toEpochMilli(), keywords, source().id(), List.of(), 0, now));
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
        JsonNode response = http().get(url("domain:example.com", 1), headers(credentials), source().timeout());
        return !response.has("success") || JsonFields.bool(response, "success");
    }

    private List<JsonNode> search(String operation, String query) {
        JsonNode response = runtime.execute(operation, creds -> {
            JsonNode body = http().get(url(query, PAGE_SIZE), headers(creds), source().timeout());
            if (body.has("balance") && JsonFields.integer(body, "balance", -1) == 0) {
                throw new ProviderRateLimitException("DeHashed query balance exhausted");
            }
            return body;
        });
        var entries = JsonFields.array(response, "entries");
        log.debug("DeHashed {} returned {} entries (total {})", operation, entries.size(),
                JsonFields.integer(response, "total", entries.size()));
        return entries;
    }

    CredentialResult mapCredential(JsonNode entry, boolean includePasswords, Instant now) {
        String email = JsonFields.text(entry, "email");
        String plain = includePasswords ? blankToNull(JsonFields.text(entry, "password")) : null;

        var metadata = new HashMap<String, Object>();
        metadata.put("databaseName", JsonFields.text(entry, "database_name"));
        metadata.put("ipAddress", JsonFields.text(entry, "ip_address"));

        return new CredentialResult(
                JsonFields.text(entry, "id"),
                source().id(),
                email,
                blankToNull(JsonFields.text(entry, "username")),
                domainOf(email),
                blankToNull(JsonFields.text(entry, "hashed_password")),
                plain,
                JsonFields.text(entry, "database_name"),
                null,
                now,
                ENTRY_CONFIDENCE,
                RiskScoring.credentialScore(plain != null, ENTRY_CONFIDENCE, null, 0.0, now),
                metadata);
    }

    BreachResult toBreach(String database, List<JsonNode> entries, boolean includePasswords, Instant now) {
        Set<String> emails = new LinkedHashSet<>();
        Set<String> domains = new LinkedHashSet<>();
        Set<String> dataTypes = new LinkedHashSet<>();
        for (JsonNode entry : entries) {
            String email = blankToNull(JsonFields.text(entry, "email"));
            if (email != null) {
                emails.add(email);
                String domain = domainOf(email);
                if (domain != null) {
                    domains.add(domain);
                }
            }
            DATA_TYPE_FIELDS.forEach((field, type) -> {
                if (blankToNull(JsonFields.text(entry, field)) != null) {
                    dataTypes.add(type);
                }
            });
        }
        var types = dataTypes.stream().sorted().toList();
        var metadata = new HashMap<String, Object>();
        metadata.put("entryCount", entries.size());
        metadata.put("passwordsRequested", includePasswords);

        return new BreachResult(
                source().id() + ":" + database,
                source().id(),
                database,
                null,
                now,
                entries.size(),
                types,
                "Entries found in " + database,
                true,
                RiskScoring.breachScore(true, null, entries.size(), types, now),
                List.copyOf(emails),
                List.copyOf(domains),
                metadata);
    }

    private static String domainOf(String email) {
        if (email == null) {
            return null;
        }
        int at = email.lastIndexOf('@');
        return at >= 0 && at < email.length() - 1 ? email.substring(at + 1).toLowerCase(Locale.ROOT) : null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private Map<String, String> headers(Credentials credentials) {
        var headers = new LinkedHashMap<String, String>(credentials.additionalHeaders());
        headers.put("Authorization", ProviderHttpClient.basic(credentials.token(), credentials.apiKey()));
        return headers;
    }

    private String url(String query, int size) {
        return source().baseUrl() + "/search?query=" + ProviderHttpClient.encode(query) + "&size=" + size;
    }

    private ProviderHttpClient http() {
        return runtime.http();
    }
}
