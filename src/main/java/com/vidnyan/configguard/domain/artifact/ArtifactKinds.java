package com.vidnyan.configguard.domain.artifact;

/**
 * Well-known artifact kind names used by the bundled rule set.
 * Any other kind is accepted and simply ignored by rules that do not name it.
 */
public final class ArtifactKinds {

    public static final String DOCKERFILE = "dockerfile";
    public static final String COMPOSE = "docker-compose";
    public static final String KUBERNETES = "kubernetes";
    public static final String CICD = "cicd";

    private ArtifactKinds() {
    }
}
