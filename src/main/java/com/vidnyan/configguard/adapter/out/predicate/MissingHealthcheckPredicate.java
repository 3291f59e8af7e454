package com.vidnyan.configguard.adapter.out.predicate;

import com.vidnyan.configguard.domain.rule.PredicateResult;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Triggers when no health check is declared: Dockerfile {@code HEALTHCHECK} (not {@code NONE}),
 * compose {@code healthcheck:}, or a manifest {@code livenessProbe:}.
 */
@Component
public class MissingHealthcheckPredicate extends LinePredicateSupport {

    public static final String NAME = "missing_healthcheck";

    private static final Pattern DOCKERFILE_HEALTHCHECK = declaration("^\\s*HEALTHCHECK\\s+(?!NONE\\b)\\S");
    private static final Pattern HEALTHCHECK_KEY = mappingKey("healthcheck|livenessProbe", "");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PredicateResult evaluate(String artifactText) {
        boolean declared = declares(artifactText, DOCKERFILE_HEALTHCHECK) || declares(artifactText, HEALTHCHECK_KEY);
        return declared ? PredicateResult.satisfied() : PredicateResult.violation();
    }
}
