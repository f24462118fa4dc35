package com.darkwatch.dispatch.cli;

import com.darkwatch.core.credentials.VerificationResult;
import com.darkwatch.core.health.HealthAlert;
import com.darkwatch.core.model.BreachResult;
import com.darkwatch.core.model.CredentialResult;
import com.darkwatch.core.model.HealthStatus;
import com.darkwatch.core.model.KeywordMonitorResult;
import com.darkwatch.core.model.MarketplaceResult;
import com.darkwatch.core.registry.RegistryStats;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Darkwatch CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) DARKWATCH v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [DARKWATCH]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void sourceHealth(HealthStatus status) {
        String label = status.sourceId() + ": " + status.responseTimeMs() + "ms";
        if (status.healthy()) {
            success(label);
        } else {
            error(label + ", " + status.consecutiveErrors() + " consecutive errors"
                    + (status.lastError() != null ? " (" + status.lastError() + ")" : ""));
        }
    }

    public static void verification(VerificationResult r) {
        if (r.valid()) {
            success(r.secretId() + ": credentials verified"
                    + (r.fromCache() ? " (cached)" : " (" + r.responseTimeMs() + "ms)"));
        } else {
            error(r.secretId() + ": credentials rejected" + (r.error() != null ? " (" + r.error() + ")" : ""));
        }
    }

    public static void registryStats(RegistryStats stats) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Sources: " + stats.totalConnectors() + " registered, @|fg(green) " + stats.healthyConnectors()
                + " healthy|@" + (stats.unhealthyConnectors() > 0
                        ? ", @|fg(red) " + stats.unhealthyConnectors() + " unhealthy|@" : "")));
    }

    public static void credential(CredentialResult r) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + risk(r.riskScore()) + " " + nonNull(r.email(), r.username())
                + " @|faint [" + r.sourceId() + "]|@ " + nonNull(r.breachName(), "unknown breach")
                + (r.plainTextPassword() != null ? " @|fg(red) plaintext|@" : "")));
    }

    public static void breach(BreachResult r) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + risk(r.riskScore()) + " " + r.breachName()
                + " @|faint [" + r.sourceId() + "]|@ " + r.affectedRecords() + " records"
                + (r.verified() ? ", verified" : "")
                + (r.dataTypes().isEmpty() ? "" : ", " + String.join("/", r.dataTypes()))));
    }

    public static void marketplace(MarketplaceResult r) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + risk(r.riskScore()) + " " + r.title()
                + " @|faint [" + r.sourceId() + "]|@ " + nonNull(r.marketplace(), "")
                + (r.price() != null ? " " + r.price().toPlainString() + " " + nonNull(r.currency(), "") : "")));
    }

    public static void keywords(KeywordMonitorResult r) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold " + r.sourceId() + "|@: " + r.totalMatches() + " matches"));
        for (var match : r.matches()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  " + risk(match.riskScore()) + " " + nonNull(match.title(), match.url())));
        }
    }

    public static void alert(HealthAlert alert) {
        String color = switch (alert.type()) {
            case SOURCE_RECOVERED -> "fg(green)";
            case HIGH_RESPONSE_TIME -> "fg(yellow)";
            default -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|" + color + ",bold [" + alert.type() + "]|@ " + alert.sourceId()
                + (alert.details().isEmpty() ? "" : " " + alert.details())));
    }

    private static String risk(int score) {
        String color = score >= 75 ? "fg(red)" : score >= 50 ? "fg(yellow)" : "fg(green)";
        return "@|" + color + " " + String.format("%3d", score) + "|@";
    }

    private static String nonNull(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
