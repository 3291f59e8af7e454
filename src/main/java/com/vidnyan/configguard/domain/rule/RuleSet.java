package com.vidnyan.configguard.domain.rule;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, immutable collection of enabled rules loaded from one rule document.
 * Rule ids are unique within a set.
 * Document order is the tie-break order for findings.
 */
public record RuleSet(
    String source,
    List<RuleDefinition> rules
) {

    public RuleSet {
        rules = List.copyOf(rules);
        Set<String> ids = new HashSet<>();
        for (RuleDefinition rule : rules) {
            if (!ids.add(rule.id())) {
                throw new IllegalArgumentException("Duplicate rule id '" + rule.id() + "' in " + source);
            }
        }
    }

    public static RuleSet of(String source, List<RuleDefinition> rules) {
        return new RuleSet(source, rules);
    }

    public Optional<RuleDefinition> findById(String ruleId) {
        return rules.stream()
                .filter(r -> r.id().equals(ruleId))
                .findFirst();
    }

    public int size() {
        return rules.size();
    }
}
