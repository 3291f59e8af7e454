package com.vidnyan.configguard.adapter.out.predicate;

import com.vidnyan.configguard.domain.rule.PredicateResult;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Triggers when the security context never sets {@code runAsNonRoot: true}.
 */
@Component
public class MissingSecurityContextPredicate extends LinePredicateSupport {

    public static final String NAME = "missing_security_context";

    private static final Pattern RUN_AS_NON_ROOT = mappingKey("runAsNonRoot", "\\s*[\"']?true\\b");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PredicateResult evaluate(String artifactText) {
        return declares(artifactText, RUN_AS_NON_ROOT) ? PredicateResult.satisfied() : PredicateResult.violation();
    }
}
