package com.vidnyan.configguard.domain.scan;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Production readiness verdict.
 */
public record Compliance(
    @JsonProperty("production_ready") boolean productionReady,
    @JsonProperty("missing_requirements") List<String> missingRequirements
) {

    public Compliance {
        missingRequirements = List.copyOf(missingRequirements);
    }
}
