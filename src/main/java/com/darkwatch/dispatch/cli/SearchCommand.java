package com.darkwatch.dispatch.cli;

import com.darkwatch.core.config.ConnectorBootstrap;
import com.darkwatch.core.model.BreachQuery;
import com.darkwatch.core.model.CredentialQuery;
import com.darkwatch.core.model.DateRange;
import com.darkwatch.core.model.MarketplaceQuery;
import com.darkwatch.core.registry.ConnectorRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: darkwatch search &lt;category&gt;
 * <p>
 * Fans a query out to every healthy source and prints the merged, deduplicated results.
 */
@Command(name = "search", mixinStandardHelpOptions = true, description = "Search across all healthy sources")
@Component
public class SearchCommand implements Callable<Integer> {

    enum Category { CREDENTIALS, BREACHES, MARKETPLACES, KEYWORDS }

    @Parameters(index = "0", description = "What to search: ${COMPLETION-CANDIDATES}")
    Category category;

    @Option(names = {"--email", "-e"}, description = "Email address (repeatable)")
    List<String> emails = new ArrayList<>();

    @Option(names = {"--domain", "-d"}, description = "Domain (repeatable)")
    List<String> domains = new ArrayList<>();

    @Option(names = {"--username", "-u"}, description = "Username (repeatable)")
    List<String> usernames = new ArrayList<>();

    @Option(names = {"--keyword", "-k"}, description = "Keyword (repeatable)")
    List<String> keywords = new ArrayList<>();

    @Option(names = {"--breach", "-b"}, description = "Breach name fragment to keep (repeatable)")
    List<String> breachNames = new ArrayList<>();

    @Option(names = {"--days"}, description = "Look back this many days (default: ${DEFAULT-VALUE})", defaultValue = "30")
    int days;

    @Option(names = {"--include-passwords"}, description = "Ask providers for plaintext passwords")
    boolean includePasswords;

    @Option(names = {"--min-confidence"}, description = "Minimum credential confidence in [0, 1]")
    Double minConfidence;

    @Option(names = {"--min-risk"}, description = "Minimum marketplace risk score in [0, 100]")
    Integer minRisk;

    @Option(names = {"--verified-only"}, description = "Only verified breaches")
    boolean verifiedOnly;

    private final ConnectorBootstrap bootstrap;
    private final ConnectorRegistry registry;
    private final Clock clock;

    public SearchCommand(ConnectorBootstrap bootstrap, ConnectorRegistry registry, Clock clock) {
        this.bootstrap = bootstrap;
        this.registry = registry;
        this.clock = clock;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (days < 1) {
            ConsoleOutput.error("--days must be at least 1");
            return 1;
        }
        bootstrap.start();
        if (registry.healthyConnectors().isEmpty()) {
            ConsoleOutput.error("No healthy sources available");
            return 2;
        }

        var range = DateRange.lastDays(clock.instant(), days);
        try {
            switch (category) {
                case CREDENTIALS -> {
                    var results = registry.searchCredentials(new CredentialQuery(
                            emails, domains, usernames, List.of(), range, includePasswords, minConfidence)).join();
                    results.forEach(ConsoleOutput::credential);
                    ConsoleOutput.info(results.size() + " exposed credential(s)");
                }
                case BREACHES -> {
                    var results = registry.searchBreachDatabases(new BreachQuery(
                            emails, domains, breachNames, range, includePasswords, verifiedOnly)).join();
                    results.forEach(ConsoleOutput::breach);
                    ConsoleOutput.info(results.size() + " breach(es)");
                }
                case MARKETPLACES -> {
                    var results = registry.searchMarketplaces(new MarketplaceQuery(
                            keywords, domains, List.of(), range, minRisk, false)).join();
                    results.forEach(ConsoleOutput::marketplace);
                    ConsoleOutput.info(results.size() + " listing(s)");
                }
                case KEYWORDS -> {
                    if (keywords.isEmpty()) {
                        ConsoleOutput.error("At least one --keyword is required");
                        return 1;
                    }
                    var results = registry.monitorKeywords(keywords).join();
                    results.forEach(ConsoleOutput::keywords);
                }
            }
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid query: " + e.getMessage());
            return 1;
        }
        return 0;
    }
}
