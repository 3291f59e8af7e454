package com.vidnyan.configguard.domain.rule;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Rule definition - describes what to check, where, and how bad a hit is.
 * Immutable value object loaded from a YAML/JSON rule document.
 * <p>
 * Exactly one check kind applies: PATTERN rules carry compiled expressions,
 * LOGIC rules carry the name of a registered {@link ArtifactPredicate}.
 */
public record RuleDefinition(
    String id,
    String description,
    String message,
    Severity severity,
    CheckKind checkKind,
    List<Pattern> patterns,
    String predicate,
    List<String> appliesTo,
    String remediation,
    boolean enabled
) {

    /**
     * Ordered by decreasing impact.
     */
    public enum Severity {
        CRITICAL,   // Blocks deployment
        HIGH,       // Requires review before deployment
        MEDIUM,     // Should fix
        LOW         // Best practice
    }

    public enum CheckKind {
        PATTERN,
        LOGIC
    }

    public RuleDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Rule id is required");
        }
        if (severity == null) {
            throw new IllegalArgumentException("Rule " + id + " has no severity");
        }
        if (checkKind == null) {
            throw new IllegalArgumentException("Rule " + id + " has no check kind");
        }
        if (appliesTo == null || appliesTo.isEmpty()) {
            throw new IllegalArgumentException("Rule " + id + " applies to no artifact kind");
        }
        patterns = patterns != null ? List.copyOf(patterns) : List.of();
        appliesTo = List.copyOf(appliesTo);

        switch (checkKind) {
            case PATTERN -> {
                if (patterns.isEmpty()) {
                    throw new IllegalArgumentException("PATTERN rule " + id + " has no patterns");
                }
                if (predicate != null) {
                    throw new IllegalArgumentException("PATTERN rule " + id + " must not name a predicate");
                }
            }
            case LOGIC -> {
                if (predicate == null || predicate.isBlank()) {
                    throw new IllegalArgumentException("LOGIC rule " + id + " has no predicate");
                }
                if (!patterns.isEmpty()) {
                    throw new IllegalArgumentException("LOGIC rule " + id + " must not declare patterns");
                }
            }
        }
    }

    /**
     * Text used for findings: explicit message, else description, else the id.
     */
    public String findingMessage() {
        if (message != null && !message.isBlank()) {
            return message;
        }
        if (description != null && !description.isBlank()) {
            return description;
        }
        return id;
    }

    public Optional<String> remediationHint() {
        return Optional.ofNullable(remediation).filter(r -> !r.isBlank());
    }

    public boolean appliesTo(String artifactKind) {
        return appliesTo.contains(artifactKind);
    }

    /**
     * Raw expressions, as written in the rule document.
     */
    public List<String> patternSources() {
        return patterns.stream().map(Pattern::pattern).toList();
    }

    /**
     * Builder for RuleDefinition.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String description;
        private String message;
        private Severity severity;
        private CheckKind checkKind;
        private List<Pattern> patterns = List.of();
        private String predicate;
        private List<String> appliesTo = List.of();
        private String remediation;
        private boolean enabled = true;

        public Builder id(String id) { this.id = id; return this; }
        public Builder description(String desc) { this.description = desc; return this; }
        public Builder message(String msg) { this.message = msg; return this; }
        public Builder severity(Severity sev) { this.severity = sev; return this; }
        public Builder checkKind(CheckKind kind) { this.checkKind = kind; return this; }
        public Builder patterns(List<Pattern> patterns) { this.patterns = patterns; return this; }
        public Builder predicate(String predicate) { this.predicate = predicate; return this; }
        public Builder appliesTo(List<String> kinds) { this.appliesTo = kinds; return this; }
        public Builder remediation(String rem) { this.remediation = rem; return this; }
        public Builder enabled(boolean enabled) { this.enabled = enabled; return this; }

        /**
         * Compile and add expressions case-insensitively.
         */
        public Builder pattern(String... expressions) {
            List<Pattern> compiled = new ArrayList<>(this.patterns);
            for (String expression : expressions) {
                compiled.add(Pattern.compile(expression, Pattern.CASE_INSENSITIVE));
            }
            this.patterns = compiled;
            return this;
        }

        public Builder appliesTo(String... kinds) {
            return appliesTo(List.of(kinds));
        }

        public RuleDefinition build() {
            return new RuleDefinition(id, description, message, severity, checkKind,
                    patterns, predicate, appliesTo, remediation, enabled);
        }
    }
}
