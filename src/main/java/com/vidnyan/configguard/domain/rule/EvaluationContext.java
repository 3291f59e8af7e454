package com.vidnyan.configguard.domain.rule;

/**
 * Context provided to rule evaluators: one rule against one present artifact.
 */
public record EvaluationContext(
    RuleDefinition rule,
    String artifactKind,
    String artifactText
) {

    /**
     * Create context.
     */
    public static EvaluationContext of(RuleDefinition rule, String artifactKind, String artifactText) {
        return new EvaluationContext(rule, artifactKind, artifactText);
    }

    /**
     * Start a finding pre-filled from the rule and artifact.
     */
    public Finding.Builder findingBuilder() {
        return Finding.builder()
                .ruleId(rule.id())
                .severity(rule.severity())
                .message(rule.findingMessage())
                .artifactKind(artifactKind);
    }
}
