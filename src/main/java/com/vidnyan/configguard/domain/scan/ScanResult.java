package com.vidnyan.configguard.domain.scan;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.vidnyan.configguard.domain.rule.Finding;
import com.vidnyan.configguard.domain.rule.RuleDefinition.Severity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate verdict of one scan. Serialises to the JSON shape consumed by callers.
 */
@JsonPropertyOrder({"status", "total_issues", "critical", "high", "medium", "low",
        "risk_score", "issues", "compliance", "recommendations"})
public record ScanResult(
    @JsonProperty("status") GateStatus status,
    @JsonIgnore Map<Severity, Integer> severityCounts,
    @JsonProperty("risk_score") int riskScore,
    @JsonProperty("issues") List<Finding> findings,
    @JsonProperty("compliance") Compliance compliance,
    @JsonProperty("recommendations") List<String> recommendations
) {

    public ScanResult {
        EnumMap<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, severityCounts.getOrDefault(severity, 0));
        }
        severityCounts = Collections.unmodifiableMap(counts);
        findings = List.copyOf(findings);
        recommendations = List.copyOf(recommendations);
    }

    @JsonProperty("total_issues")
    public int totalIssues() {
        return findings.size();
    }

    public int count(Severity severity) {
        return severityCounts.get(severity);
    }

    @JsonProperty("critical")
    public int critical() {
        return count(Severity.CRITICAL);
    }

    @JsonProperty("high")
    public int high() {
        return count(Severity.HIGH);
    }

    @JsonProperty("medium")
    public int medium() {
        return count(Severity.MEDIUM);
    }

    @JsonProperty("low")
    public int low() {
        return count(Severity.LOW);
    }

    @JsonIgnore
    public boolean isProductionReady() {
        return compliance.productionReady();
    }
}
