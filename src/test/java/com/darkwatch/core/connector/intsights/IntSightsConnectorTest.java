package com.darkwatch.core.connector.intsights;

import com.darkwatch.core.connector.ProviderHttpClient;
import com.darkwatch.core.credentials.CredentialStore;
import com.darkwatch.core.model.BreachQuery;
import com.darkwatch.core.model.CredentialQuery;
import com.darkwatch.core.model.Credentials;
import com.darkwatch.core.model.DateRange;
import com.darkwatch.core.model.MarketplaceQuery;
import com.darkwatch.core.model.ProviderType;
import com.darkwatch.support.ConnectorFixtures;
import com.darkwatch.support.MutableClock;
import com.darkwatch.support.RecordingSleeper;
import com.darkwatch.support.StubHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link IntSightsConnector}.
 */
class IntSightsConnectorTest {

    private static final String KEY = "intsights-account-0000000001";
    private static final String SECRET = "intsights-secret-00000000001";

    private static final String PAGE_ONE = """
            {"results": [
              {"id": "l1", "title": "ACME VPN access", "url": "http://market.onion/1", "marketplace": "Genesis",
               "category": "access", "price": "250.00", "currency": "USD", "risk_score": 85,
               "keywords": ["acme"], "metadata": {"seller_rating": 4.5}},
              {"id": "l2", "title": "ACME combo list", "url": "http://market.onion/2", "severity": "low",
               "price": "n/a"}
            ], "has_more": true}
            """;

    private static final String PAGE_TWO = """
            {"results": [
              {"id": "l3", "title": "ACME database", "url": "http://market.onion/3", "severity": "high"}
            ], "has_more": false}
            """;

    private MutableClock clock;
    private StubHttpClient http;
    private IntSightsConnector connector;
    private DateRange lastWeek;

    @BeforeEach
    void setUp() throws Exception {
        clock = MutableClock.at("2024-03-01T12:00:00Z");
        http = new StubHttpClient();
        var store = mock(CredentialStore.class);
        when(store.getValidatedCredentials("intsights")).thenReturn(new Credentials(KEY, SECRET, null, null, null));
        var source = ConnectorFixtures.source("intsights", ProviderType.INTSIGHTS);
        connector = new IntSightsConnector(
                ConnectorFixtures.runtime(source, store, http, clock, new RecordingSleeper(clock)));
        lastWeek = DateRange.lastDays(clock.instant(), 7);
    }

    @Nested
    @DisplayName("searchMarketplaces")
    class MarketplaceTests {

        @Test
        @DisplayName("pages until the provider reports no more results")
        void pagination() {
            http.on("/public/v1/marketplace/search", 200, PAGE_ONE)
                .on("/public/v1/marketplace/search", 200, PAGE_TWO);

            var results = connector.searchMarketplaces(
                    new MarketplaceQuery(List.of("acme"), null, null, lastWeek, null, false)).join();

            assertEquals(3, results.size());
            assertEquals(2, http.count("/marketplace/search"));
        }

        @Test
        @DisplayName("stops after the page cap even if more pages are announced")
        void pageCap() {
            http.on("/public/v1/marketplace/search", 200, PAGE_ONE);

            var results = connector.searchMarketplaces(
                    new MarketplaceQuery(List.of("acme"), null, null, lastWeek, null, false)).join();

            assertEquals(IntSightsConnector.MAX_PAGES, http.count("/marketplace/search"));
            assertEquals(2 * IntSightsConnector.MAX_PAGES, results.size());
        }

        @Test
        @DisplayName("maps risk from score or severity and applies the minimum")
        void riskMapping() {
            http.on("/public/v1/marketplace/search", 200, PAGE_ONE)
                .on("/public/v1/marketplace/search", 200, PAGE_TWO);

            var results = connector.searchMarketplaces(
                    new MarketplaceQuery(List.of("acme"), null, null, lastWeek, 70, true)).join();

            assertEquals(List.of("l1", "l3"), results.stream().map(r -> r.id()).toList());
            assertEquals(85, results.get(0).riskScore());
            assertEquals(75, results.get(1).riskScore());
            assertEquals(new BigDecimal("250.00"), results.get(0).price());
            assertEquals(4.5, results.get(0).metadata().get("seller_rating"));
        }

        @Test
        @DisplayName("drops provider metadata and unparseable prices unless metadata is requested")
        void metadataOptional() {
            http.on("/public/v1/marketplace/search", 200, PAGE_ONE)
                .on("/public/v1/marketplace/search", 200, PAGE_TWO);

            var results = connector.searchMarketplaces(
                    new MarketplaceQuery(List.of("acme"), null, null, lastWeek, null, false)).join();

            assertTrue(results.get(0).metadata().isEmpty());
            assertNull(results.get(1).price());
            assertEquals("intsights", results.get(1).sourceId());
        }

        @Test
        @DisplayName("authenticates with basic auth of key and secret")
        void basicAuth() {
            http.on("/public/v1/marketplace/search", 200, "{\"results\": []}");

            connector.searchMarketplaces(new MarketplaceQuery(List.of("acme"), null, null, lastWeek, null, false)).join();

            assertEquals(ProviderHttpClient.basic(KEY, SECRET),
                    http.requests().get(0).headers().firstValue("Authorization").orElseThrow());
        }
    }

    @Test
    @DisplayName("keyword monitoring reads snippets and found dates")
    void keywords() {
        http.on("/public/v1/keywords/matches", 200, """
                {"matches": [{"id": "k1", "snippet": "acme secret leaked", "url": "http://paste.onion/x",
                  "found_date": "2024-02-20T00:00:00Z"}]}
                """);

        var result = connector.monitorKeywords(List.of("acme")).join();

        assertEquals(1, result.totalMatches());
        var match = result.matches().get(0);
        assertEquals("acme secret leaked", match.content());
        assertEquals(80, match.riskScore());
    }

    @Test
    @DisplayName("credential and breach searches are not offered")
    void unsupportedCategories() {
        assertTrue(connector.searchCredentials(CredentialQuery.forEmails(List.of("a@acme.com"), lastWeek)).join().isEmpty());
        assertTrue(connector.searchBreachDatabases(new BreachQuery(null, List.of("acme.com"), null, lastWeek, false, false))
                .join().isEmpty());
        assertTrue(http.requests().isEmpty());
    }

    @Test
    @DisplayName("health check treats any 2xx from the credential test as healthy")
    void healthCheck() {
        http.on("/public/v1/test-credentials", 204, "")
            .on("/public/v1/test-credentials", 403, "forbidden");

        assertTrue(connector.performHealthCheck().join().healthy());
        assertFalse(connector.performHealthCheck().join().healthy());
    }
}
