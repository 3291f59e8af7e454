package com.vidnyan.configguard.config;

import com.vidnyan.configguard.domain.rule.RuleDefinition.Severity;
import com.vidnyan.configguard.domain.scan.ScoringPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration properties for the scanner.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "configguard.scanner")
public class ScannerProperties {

    /**
     * Rule document loaded once at startup.
     * Default: bundled rules
     */
    private String rulesLocation = "classpath:rules/security-rules.yaml";

    /**
     * Risk score above which a scan without CRITICAL/HIGH findings still needs review.
     */
    private int reviewThreshold = ScoringPolicy.DEFAULT_REVIEW_THRESHOLD;

    /**
     * Upper bound of the risk score.
     */
    private int maxScore = ScoringPolicy.DEFAULT_MAX_SCORE;

    /**
     * Per-severity weights; must strictly decrease from CRITICAL to LOW.
     */
    private Map<Severity, Integer> weights = new EnumMap<>(ScoringPolicy.defaults().weights());

    public ScoringPolicy toScoringPolicy() {
        Map<Severity, Integer> merged = new EnumMap<>(ScoringPolicy.defaults().weights());
        merged.putAll(weights);
        return new ScoringPolicy(merged, maxScore, reviewThreshold);
    }
}
