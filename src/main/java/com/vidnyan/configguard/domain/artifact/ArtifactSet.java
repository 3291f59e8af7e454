package com.vidnyan.configguard.domain.artifact;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Scan input: artifact kind to raw text.
 * Immutable. Null or blank text counts as absent, meaning "nothing to check".
 */
public final class ArtifactSet {

    private static final ArtifactSet EMPTY = new ArtifactSet(Map.of());

    private final Map<String, String> artifacts;

    private ArtifactSet(Map<String, String> artifacts) {
        this.artifacts = artifacts;
    }

    /**
     * Create from a caller map. Kinds with absent text are dropped, insertion order is kept.
     */
    public static ArtifactSet of(Map<String, String> artifacts) {
        if (artifacts == null || artifacts.isEmpty()) {
            return EMPTY;
        }
        Map<String, String> copy = new LinkedHashMap<>();
        artifacts.forEach((kind, text) -> {
            if (kind == null || kind.isBlank()) {
                throw new IllegalArgumentException("Artifact kind must not be blank");
            }
            if (text != null && !text.isBlank()) {
                copy.put(kind, text);
            }
        });
        return new ArtifactSet(Collections.unmodifiableMap(copy));
    }

    public static ArtifactSet single(String kind, String text) {
        Map<String, String> map = new LinkedHashMap<>();
        map.put(kind, text);
        return of(map);
    }

    public static ArtifactSet empty() {
        return EMPTY;
    }

    public Optional<String> get(String kind) {
        return Optional.ofNullable(artifacts.get(kind));
    }

    public boolean isPresent(String kind) {
        return artifacts.containsKey(kind);
    }

    public Set<String> kinds() {
        return artifacts.keySet();
    }

    public int size() {
        return artifacts.size();
    }

    public boolean isEmpty() {
        return artifacts.isEmpty();
    }

    /**
     * Copy with one more artifact; replaces an existing kind.
     */
    public ArtifactSet with(String kind, String text) {
        Map<String, String> copy = new LinkedHashMap<>(artifacts);
        copy.put(kind, text);
        return of(copy);
    }

    public Map<String, String> asMap() {
        return artifacts;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ArtifactSet other && artifacts.equals(other.artifacts);
    }

    @Override
    public int hashCode() {
        return artifacts.hashCode();
    }

    @Override
    public String toString() {
        return "ArtifactSet" + artifacts.keySet();
    }
}
