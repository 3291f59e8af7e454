package com.vidnyan.configguard.adapter.out.predicate;

import com.vidnyan.configguard.domain.rule.PredicateResult;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Triggers when no upper-bound resource section exists ({@code limits:} or compose {@code mem_limit:}).
 * A {@code requests:} section alone does not count.
 */
@Component
public class MissingResourceLimitsPredicate extends LinePredicateSupport {

    public static final String NAME = "missing_resource_limits";

    private static final Pattern LIMITS = mappingKey("limits|mem_limit", "");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PredicateResult evaluate(String artifactText) {
        return declares(artifactText, LIMITS) ? PredicateResult.satisfied() : PredicateResult.violation();
    }
}
