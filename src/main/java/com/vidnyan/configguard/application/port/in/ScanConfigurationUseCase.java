package com.vidnyan.configguard.application.port.in;

import com.vidnyan.configguard.domain.artifact.ArtifactSet;
import com.vidnyan.configguard.domain.rule.RuleSet;
import com.vidnyan.configguard.domain.scan.ScanResult;

/**
 * Primary use case: scan generated deployment artifacts and decide whether they may ship.
 */
public interface ScanConfigurationUseCase {

    /**
     * Scan with the rule set loaded at startup.
     */
    ScanResult scan(ArtifactSet artifacts);

    /**
     * Scan with a caller-supplied rule set.
     */
    ScanResult scan(RuleSet rules, ArtifactSet artifacts);

    /**
     * Scan a single artifact, e.g. only a Dockerfile.
     */
    default ScanResult scanArtifact(String artifactKind, String text) {
        return scan(ArtifactSet.single(artifactKind, text));
    }

    /**
     * Rules active for {@link #scan(ArtifactSet)}.
     */
    RuleSet activeRules();
}
