package com.vidnyan.configguard.domain.rule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup of LOGIC predicates by name.
 * The rule repository consults it at load time so an unknown predicate fails fast.
 */
public class PredicateRegistry {

    private final Map<String, ArtifactPredicate> predicates;

    public PredicateRegistry(List<ArtifactPredicate> predicates) {
        Map<String, ArtifactPredicate> byName = new LinkedHashMap<>();
        for (ArtifactPredicate predicate : predicates) {
            ArtifactPredicate previous = byName.putIfAbsent(predicate.name(), predicate);
            if (previous != null) {
                throw new IllegalStateException("Duplicate predicate name: " + predicate.name());
            }
        }
        this.predicates = Collections.unmodifiableMap(byName);
    }

    public Optional<ArtifactPredicate> find(String name) {
        return Optional.ofNullable(predicates.get(name));
    }

    /**
     * Resolve a predicate the rule set already validated.
     */
    public ArtifactPredicate require(String name) {
        return find(name).orElseThrow(() ->
                new IllegalStateException("No predicate registered under '" + name + "'"));
    }

    public boolean contains(String name) {
        return predicates.containsKey(name);
    }

    public Set<String> names() {
        return predicates.keySet();
    }
}
