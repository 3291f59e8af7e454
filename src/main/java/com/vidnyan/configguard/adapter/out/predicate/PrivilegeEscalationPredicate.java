package com.vidnyan.configguard.adapter.out.predicate;

import com.vidnyan.configguard.domain.rule.PredicateResult;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Triggers on an explicit {@code allowPrivilegeEscalation: true}. Positive check, so the
 * offending line is reported.
 */
@Component
public class PrivilegeEscalationPredicate extends LinePredicateSupport {

    public static final String NAME = "privilege_escalation_enabled";

    private static final Pattern ESCALATION_ALLOWED =
            mappingKey("allowPrivilegeEscalation", "\\s*[\"']?true\\b");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PredicateResult evaluate(String artifactText) {
        return firstDeclaration(artifactText, ESCALATION_ALLOWED)
                .map(line -> PredicateResult.violatedAt(line.number(), line.snippet()))
                .orElse(PredicateResult.satisfied());
    }
}
