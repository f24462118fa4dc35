package com.darkwatch.core.connector;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Provider-independent risk heuristics. Every score is clamped to [0, 100].
 */
public final class RiskScoring {

    private static final Set<String> SENSITIVE_DATA_TYPES = Set.of("password", "ssn", "credit_card", "financial");
    private static final List<String> HIGH_RISK_TERMS = List.of("password", "credential", "login", "api_key", "secret");

    private RiskScoring() {
    }

    public static int credentialScore(boolean plainTextPassword, double confidence, Instant breachDate,
                                      double sourceReliability, Instant now) {
        int score = 50;
        if (plainTextPassword) {
            score += 30;
        }
        if (confidence > 0.8) {
            score += 15;
        }
        double days = daysBetween(breachDate, now);
        if (days < 30) {
            score += 20;
        } else if (days < 90) {
            score += 10;
        }
        if (sourceReliability > 0.8) {
            score += 10;
        }
        return clamp(score);
    }

    public static int breachScore(boolean verified, Instant breachDate, long affectedRecords,
                                  List<String> dataTypes, Instant now) {
        int score = 40;
        if (verified) {
            score += 20;
        }
        double days = daysBetween(breachDate, now);
        if (days < 90) {
            score += 25;
        } else if (days < 365) {
            score += 15;
        }
        if (affectedRecords > 1_000_000) {
            score += 15;
        } else if (affectedRecords > 100_000) {
            score += 10;
        }
        if (dataTypes != null && dataTypes.stream()
                .anyMatch(t -> t != null && SENSITIVE_DATA_TYPES.contains(t.toLowerCase(Locale.ROOT)))) {
            score += 20;
        }
        return clamp(score);
    }

    public static int keywordScore(String content, String context, Instant discoveredDate, Instant now) {
        int score = 30;
        if (containsHighRiskTerm(content) || containsHighRiskTerm(context)) {
            score += 40;
        }
        double days = daysBetween(discoveredDate, now);
        if (days < 7) {
            score += 20;
        } else if (days < 30) {
            score += 10;
        }
        return clamp(score);
    }

    public static int riskLevelScore(String riskLevel) {
        return switch (normalize(riskLevel)) {
            case "critical" -> 90;
            case "high" -> 75;
            case "medium" -> 55;
            case "low" -> 30;
            default -> 40;
        };
    }

    public static double riskLevelConfidence(String riskLevel) {
        return switch (normalize(riskLevel)) {
            case "critical" -> 0.95;
            case "high" -> 0.85;
            case "medium" -> 0.70;
            case "low" -> 0.50;
            default -> 0.60;
        };
    }

    public static int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }

    private static boolean containsHighRiskTerm(String text) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return HIGH_RISK_TERMS.stream().anyMatch(lower::contains);
    }

    // Unknown dates count as old.
    private static double daysBetween(Instant then, Instant now) {
        if (then == null) {
            return Double.MAX_VALUE;
        }
        return Duration.between(then, now).toMillis() / 86_400_000.0;
    }

    private static String normalize(String riskLevel) {
        return riskLevel == null ? "" : riskLevel.toLowerCase(Locale.ROOT);
    }
}
