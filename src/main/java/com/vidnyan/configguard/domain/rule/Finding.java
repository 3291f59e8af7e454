package com.vidnyan.configguard.domain.rule;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One rule violation in one artifact.
 * Immutable value object; severity is copied from the rule at evaluation time.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"rule_id", "severity", "message", "location", "line", "matched", "fix"})
public record Finding(
    @JsonProperty("rule_id") String ruleId,
    @JsonProperty("severity") RuleDefinition.Severity severity,
    @JsonProperty("message") String message,
    @JsonProperty("location") String artifactKind,
    @JsonProperty("line") Integer line,
    @JsonProperty("matched") String matched,
    @JsonProperty("fix") String fix
) {

    /**
     * Identity used for deduplication: one finding per rule per artifact.
     */
    @JsonIgnore
    public String fingerprint() {
        return ruleId + "@" + artifactKind;
    }

    /**
     * Copy carrying remediation text.
     */
    public Finding withFix(String fixText) {
        return new Finding(ruleId, severity, message, artifactKind, line, matched, fixText);
    }

    /**
     * Format location for display.
     */
    public String formattedLocation() {
        return line != null ? artifactKind + ":" + line : artifactKind;
    }

    /**
     * Builder for Finding.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String ruleId;
        private RuleDefinition.Severity severity;
        private String message;
        private String artifactKind;
        private Integer line;
        private String matched;
        private String fix;

        public Builder ruleId(String id) { this.ruleId = id; return this; }
        public Builder severity(RuleDefinition.Severity sev) { this.severity = sev; return this; }
        public Builder message(String msg) { this.message = msg; return this; }
        public Builder artifactKind(String kind) { this.artifactKind = kind; return this; }
        public Builder line(Integer line) { this.line = line; return this; }
        public Builder matched(String snippet) { this.matched = snippet; return this; }
        public Builder fix(String fix) { this.fix = fix; return this; }

        public Finding build() {
            return new Finding(ruleId, severity, message, artifactKind, line, matched, fix);
        }
    }
}
