package com.vidnyan.configguard.domain.scan;

import com.vidnyan.configguard.domain.rule.BuiltInRuleIds;
import com.vidnyan.configguard.domain.rule.Finding;
import com.vidnyan.configguard.domain.rule.RuleDefinition.Severity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reduces a findings list to a {@link ScanResult}: counts, bounded risk score,
 * gating status, production readiness and recommendations.
 */
@Slf4j
public class FindingAggregator {

    static final String CRITICAL_RECOMMENDATION = "CRITICAL issues must be fixed before deployment";
    static final String GENERIC_RECOMMENDATION = "Review the reported issues and apply the suggested fixes";
    static final String BEST_PRACTICES = "Configuration follows security best practices";

    private static final Map<String, String> CATEGORY_RECOMMENDATIONS = new LinkedHashMap<>();

    static {
        CATEGORY_RECOMMENDATIONS.put(BuiltInRuleIds.HARDCODED_SECRET,
                "Move secrets out of configuration files into environment variables or a secrets manager");
        CATEGORY_RECOMMENDATIONS.put(BuiltInRuleIds.ROOT_USER, "Add non-root user to Dockerfile");
        CATEGORY_RECOMMENDATIONS.put(BuiltInRuleIds.PRIVILEGE_ESCALATION,
                "Disable privilege escalation with allowPrivilegeEscalation: false");
        CATEGORY_RECOMMENDATIONS.put(BuiltInRuleIds.LATEST_TAG, "Use specific version tags instead of :latest");
        CATEGORY_RECOMMENDATIONS.put(BuiltInRuleIds.RESOURCE_LIMITS,
                "Set resource limits to prevent resource exhaustion");
        CATEGORY_RECOMMENDATIONS.put(BuiltInRuleIds.SECURITY_CONTEXT,
                "Configure security context with runAsNonRoot: true");
        CATEGORY_RECOMMENDATIONS.put(BuiltInRuleIds.EXPOSED_PORTS, "Stop exposing SSH and database ports");
        CATEGORY_RECOMMENDATIONS.put(BuiltInRuleIds.HEALTHCHECK, "Add health checks for better reliability");
    }

    private final ScoringPolicy policy;

    public FindingAggregator(ScoringPolicy policy) {
        this.policy = policy;
    }

    public ScanResult aggregate(List<Finding> findings) {
        List<Finding> unique = deduplicate(findings);

        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Finding finding : unique) {
            counts.merge(finding.severity(), 1, Integer::sum);
        }

        int riskScore = policy.score(counts);
        int critical = counts.getOrDefault(Severity.CRITICAL, 0);
        GateStatus status = gate(critical, counts.getOrDefault(Severity.HIGH, 0), riskScore);

        List<String> missing = new ArrayList<>();
        for (ProductionRequirement requirement : ProductionRequirement.values()) {
            if (requirement.isUnmetBy(unique)) {
                missing.add(requirement.displayName());
            }
        }
        Compliance compliance = new Compliance(missing.isEmpty() && critical == 0, missing);

        log.debug("Aggregated {} findings ({} duplicates dropped): score={}, status={}",
                unique.size(), findings.size() - unique.size(), riskScore, status);

        return new ScanResult(status, counts, riskScore, unique, compliance, recommendations(unique, critical));
    }

    /**
     * CRITICAL always blocks, independent of the numeric score.
     */
    GateStatus gate(int critical, int high, int riskScore) {
        if (critical > 0) {
            return GateStatus.BLOCKED;
        }
        if (high > 0 || riskScore > policy.reviewThreshold()) {
            return GateStatus.REVIEW_REQUIRED;
        }
        return GateStatus.APPROVED;
    }

    private List<Finding> deduplicate(List<Finding> findings) {
        Map<String, Finding> unique = new LinkedHashMap<>();
        for (Finding finding : findings) {
            unique.putIfAbsent(finding.fingerprint(), finding);
        }
        return List.copyOf(unique.values());
    }

    private List<String> recommendations(List<Finding> findings, int critical) {
        if (findings.isEmpty()) {
            return List.of(BEST_PRACTICES);
        }

        List<String> recommendations = new ArrayList<>();
        if (critical > 0) {
            recommendations.add(CRITICAL_RECOMMENDATION);
        }

        Set<String> triggered = findings.stream().map(Finding::ruleId).collect(Collectors.toSet());
        CATEGORY_RECOMMENDATIONS.forEach((ruleId, text) -> {
            if (triggered.contains(ruleId)) {
                recommendations.add(text);
            }
        });

        if (recommendations.isEmpty()) {
            recommendations.add(GENERIC_RECOMMENDATION);
        }
        return recommendations;
    }
}
