package com.darkwatch.core.registry;

import com.darkwatch.core.model.BreachResult;
import com.darkwatch.core.model.CredentialResult;
import com.darkwatch.core.model.MarketplaceResult;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.function.Function;

/**
 * Cross-source deduplication. The first result for a key wins, so the outcome follows
 * registration order and applying it twice changes nothing.
 */
public final class ResultDeduplicator {

    private ResultDeduplicator() {
    }

    /**
     * Keys are lists of the identifying fields, so a separator inside one field cannot make
     * two distinct findings collide.
     */
    public static List<String> credentialKey(CredentialResult r) {
        return List.of(nullToEmpty(r.email()), nullToEmpty(r.username()), nullToEmpty(r.domain()));
    }

    public static List<String> marketplaceKey(MarketplaceResult r) {
        return List.of(nullToEmpty(r.url()), nullToEmpty(r.title()));
    }

    public static List<String> breachKey(BreachResult r) {
        var key = new ArrayList<String>(r.affectedDomains().size() + 1);
        key.add(nullToEmpty(r.breachName()));
        r.affectedDomains().forEach(domain -> key.add(nullToEmpty(domain)));
        return key;
    }

    public static List<CredentialResult> credentials(List<CredentialResult> results) {
        return dedup(results, ResultDeduplicator::credentialKey);
    }

    public static List<MarketplaceResult> marketplaces(List<MarketplaceResult> results) {
        return dedup(results, ResultDeduplicator::marketplaceKey);
    }

    public static List<BreachResult> breaches(List<BreachResult> results) {
        return dedup(results, ResultDeduplicator::breachKey);
    }

    static <T> List<T> dedup(List<T> results, Function<T, List<String>> key) {
        var seen = new HashSet<List<String>>();
        var unique = new ArrayList<T>(results.size());
        for (T result : results) {
            if (seen.add(key.apply(result))) {
                unique.add(result);
            }
        }
        return List.copyOf(unique);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
