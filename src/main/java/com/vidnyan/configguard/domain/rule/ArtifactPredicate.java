package com.vidnyan.configguard.domain.rule;

/**
 * Named structural check evaluated against a whole artifact.
 * Implementations must be stateless; one instance serves concurrent scans.
 */
public interface ArtifactPredicate {

    /**
     * Name referenced by LOGIC rules in the rule document.
     */
    String name();

    /**
     * Evaluate against the full artifact text.
     */
    PredicateResult evaluate(String artifactText);
}
