package com.vidnyan.configguard.domain.scan;

import com.vidnyan.configguard.domain.rule.RuleDefinition.Severity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Severity weights, score cap and review threshold.
 * Weights must be non-negative and strictly decreasing from CRITICAL to LOW.
 */
public record ScoringPolicy(
    Map<Severity, Integer> weights,
    int maxScore,
    int reviewThreshold
) {

    public static final int DEFAULT_MAX_SCORE = 100;
    public static final int DEFAULT_REVIEW_THRESHOLD = 40;

    private static final ScoringPolicy DEFAULT = new ScoringPolicy(Map.of(
            Severity.CRITICAL, 25,
            Severity.HIGH, 10,
            Severity.MEDIUM, 5,
            Severity.LOW, 2
    ), DEFAULT_MAX_SCORE, DEFAULT_REVIEW_THRESHOLD);

    public ScoringPolicy {
        EnumMap<Severity, Integer> copy = new EnumMap<>(Severity.class);
        Integer previous = null;
        for (Severity severity : Severity.values()) {
            Integer weight = weights.get(severity);
            if (weight == null || weight < 0) {
                throw new IllegalArgumentException("Missing or negative weight for " + severity);
            }
            if (previous != null && weight >= previous) {
                throw new IllegalArgumentException(
                        "Severity weights must strictly decrease, got " + severity + "=" + weight
                                + " after " + previous);
            }
            copy.put(severity, weight);
            previous = weight;
        }
        if (maxScore <= 0) {
            throw new IllegalArgumentException("maxScore must be positive");
        }
        if (reviewThreshold < 0 || reviewThreshold > maxScore) {
            throw new IllegalArgumentException("reviewThreshold must be within [0, " + maxScore + "]");
        }
        weights = Collections.unmodifiableMap(copy);
    }

    public static ScoringPolicy defaults() {
        return DEFAULT;
    }

    public int weightOf(Severity severity) {
        return weights.get(severity);
    }

    /**
     * Weighted sum of counts, clamped to [0, maxScore].
     */
    public int score(Map<Severity, Integer> counts) {
        long total = 0;
        for (Map.Entry<Severity, Integer> entry : counts.entrySet()) {
            total += (long) weightOf(entry.getKey()) * entry.getValue();
        }
        return (int) Math.min(Math.max(total, 0), maxScore);
    }
}
